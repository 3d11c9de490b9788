package com.recursa.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Hierarchy index entry for one agent. Survives the frame being popped.
 *
 * @param agentId         the agent this entry describes
 * @param name            agent name
 * @param parentId        parent agent id, null for the root
 * @param children        ids of spawned children, in spawn order
 * @param level           depth in the hierarchy
 * @param status          last known status
 * @param finalOutput     payload or failure detail recorded on pop, empty while running
 * @param progressSummary summary of the latest consolidation snapshot
 */
public record HierarchyEntry(
    String agentId,
    String name,
    String parentId,
    List<String> children,
    int level,
    FrameStatus status,
    String finalOutput,
    String progressSummary
) implements Serializable {

    public HierarchyEntry {
        children = children == null ? List.of() : List.copyOf(children);
        finalOutput = finalOutput == null ? "" : finalOutput;
        progressSummary = progressSummary == null ? "" : progressSummary;
    }

    public static HierarchyEntry of(AgentFrame frame) {
        return new HierarchyEntry(frame.agentId(), frame.name(), frame.parentId(), List.of(),
                frame.level(), frame.status(), "", "");
    }

    public HierarchyEntry withChild(String childId) {
        if (children.contains(childId)) {
            return this;
        }
        var updated = new ArrayList<>(children);
        updated.add(childId);
        return new HierarchyEntry(agentId, name, parentId, updated, level, status, finalOutput, progressSummary);
    }

    public HierarchyEntry finished(FrameStatus newStatus, String output) {
        return new HierarchyEntry(agentId, name, parentId, children, level, newStatus, output, progressSummary);
    }

    public HierarchyEntry withProgress(String summary) {
        return new HierarchyEntry(agentId, name, parentId, children, level, status, finalOutput, summary);
    }
}
