package com.recursa.core.engine;

import com.recursa.core.model.FailureReason;

/**
 * Ends the current frame with a typed failure. Internal to the executor.
 */
class FrameFailure extends RuntimeException {

    private final FailureReason reason;

    FrameFailure(FailureReason reason, String detail) {
        super(detail);
        this.reason = reason;
    }

    FailureReason reason() {
        return reason;
    }
}
