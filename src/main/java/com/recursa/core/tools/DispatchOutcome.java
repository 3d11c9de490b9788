package com.recursa.core.tools;

import com.recursa.core.model.FailureReason;
import com.recursa.core.model.FrameResult;

/**
 * What executing one action produced.
 *
 * @param kind                   FINAL, TOOL, CHILD or VIOLATION
 * @param result                 payload on success, null on failure
 * @param errorReason            typed reason on failure, null on success
 * @param error                  error message on failure
 * @param violationLimitExceeded true when this violation exceeded the consecutive-violation limit
 * @param childResult            result of the spawned child, still on top of the stack; null otherwise
 */
public record DispatchOutcome(
    Kind kind,
    String result,
    FailureReason errorReason,
    String error,
    boolean violationLimitExceeded,
    FrameResult childResult
) {

    public enum Kind { FINAL, TOOL, CHILD, VIOLATION }

    public static DispatchOutcome success(Kind kind, String result) {
        return new DispatchOutcome(kind, result, null, null, false, null);
    }

    public static DispatchOutcome failure(Kind kind, FailureReason reason, String error) {
        return new DispatchOutcome(kind, null, reason, error, false, null);
    }

    public static DispatchOutcome violation(String error, boolean limitExceeded) {
        return new DispatchOutcome(Kind.VIOLATION, null, FailureReason.CAPABILITY_VIOLATION, error,
                limitExceeded, null);
    }

    /**
     * Converts a child's result into the outcome recorded in the parent's history.
     */
    public static DispatchOutcome fromChild(FrameResult child) {
        if (child.completed()) {
            return new DispatchOutcome(Kind.CHILD, child.payload(), null, null, false, child);
        }
        return new DispatchOutcome(Kind.CHILD, null, FailureReason.CHILD_FAILED,
                "Sub-agent " + child.agentId() + " failed [" + child.reason() + "]: " + child.detail(), false, child);
    }

    public boolean failed() {
        return errorReason != null;
    }
}
