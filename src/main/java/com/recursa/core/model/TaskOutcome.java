package com.recursa.core.model;

import java.util.List;

/**
 * Tagged result of a top-level {@code start} or {@code resume}.
 * A failed outcome always references the partial fact history of the root frame.
 *
 * @param taskId             the task
 * @param status             COMPLETED or FAILED
 * @param payload            final output when completed
 * @param reason             failure reason when failed
 * @param detail             failure detail when failed
 * @param rootAgentId        root frame id, null if no frame was ever pushed
 * @param partialFactHistory fact history of the root frame at the time of failure, empty when completed
 */
public record TaskOutcome(
    String taskId,
    FrameStatus status,
    String payload,
    FailureReason reason,
    String detail,
    String rootAgentId,
    List<ActionRecord> partialFactHistory
) {

    public TaskOutcome {
        partialFactHistory = partialFactHistory == null ? List.of() : List.copyOf(partialFactHistory);
    }

    public static TaskOutcome completed(String taskId, String rootAgentId, String payload) {
        return new TaskOutcome(taskId, FrameStatus.COMPLETED, payload, null, null, rootAgentId, List.of());
    }

    public static TaskOutcome failed(String taskId, String rootAgentId, FailureReason reason, String detail,
                                     List<ActionRecord> partialFactHistory) {
        return new TaskOutcome(taskId, FrameStatus.FAILED, null, reason, detail, rootAgentId, partialFactHistory);
    }

    public boolean completed() {
        return status == FrameStatus.COMPLETED;
    }
}
