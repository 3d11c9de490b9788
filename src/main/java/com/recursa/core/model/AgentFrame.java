package com.recursa.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One level of a nested agent invocation.
 *
 * @param agentId   unique id within the task
 * @param name      agent name, a key of the agent catalog
 * @param parentId  id of the spawning frame, null for the root
 * @param level     depth in the hierarchy, 0 for the root
 * @param input     the task text handed to this agent
 * @param arguments arguments of the spawn action that created this frame, empty for the root
 * @param status    RUNNING until popped
 * @param startedAt when the frame was pushed
 */
public record AgentFrame(
    String agentId,
    String name,
    String parentId,
    int level,
    String input,
    Map<String, Object> arguments,
    FrameStatus status,
    Instant startedAt
) implements Serializable {

    public AgentFrame {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public AgentFrame withStatus(FrameStatus newStatus) {
        return new AgentFrame(agentId, name, parentId, level, input, arguments, newStatus, startedAt);
    }

    public boolean root() {
        return parentId == null;
    }
}
