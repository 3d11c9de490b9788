package com.recursa.core.model;

/**
 * Terminal result of one frame, handed back to the parent frame or the entry point.
 *
 * @param agentId the frame that produced it
 * @param status  COMPLETED or FAILED
 * @param payload final output on completion, null on failure
 * @param reason  failure reason, null on completion
 * @param detail  human-readable failure detail including last known progress, null on completion
 */
public record FrameResult(
    String agentId,
    FrameStatus status,
    String payload,
    FailureReason reason,
    String detail
) {

    public static FrameResult completed(String agentId, String payload) {
        return new FrameResult(agentId, FrameStatus.COMPLETED, payload, null, null);
    }

    public static FrameResult failed(String agentId, FailureReason reason, String detail) {
        return new FrameResult(agentId, FrameStatus.FAILED, null, reason, detail);
    }

    public boolean completed() {
        return status == FrameStatus.COMPLETED;
    }
}
