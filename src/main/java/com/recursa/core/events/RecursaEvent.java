package com.recursa.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during task execution, consumed by the CLI and by tests.
 *
 * @param eventType event type (e.g. "task.started", "frame.pushed", "consolidation.degraded")
 * @param taskId    the task this event belongs to
 * @param agentId   the frame this event relates to (nullable for task-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record RecursaEvent(
    String eventType,
    String taskId,
    String agentId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static RecursaEvent of(String eventType, String taskId, String agentId, Map<String, Object> payload) {
        return new RecursaEvent(eventType, taskId, agentId, payload, Instant.now());
    }
}
