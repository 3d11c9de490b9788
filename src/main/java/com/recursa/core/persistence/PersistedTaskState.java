package com.recursa.core.persistence;

import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.FrameStatus;
import com.recursa.core.model.HierarchyEntry;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything needed to rebuild a task after a crash: the active stack, the
 * hierarchy index, and every frame's history. Written as one document so a
 * store can replace it atomically.
 *
 * @param taskId       task identifier
 * @param rootAgent    name of the root agent
 * @param initialInput input the task was started with
 * @param stack        active frames, root first
 * @param hierarchy    hierarchy index keyed by agent id, in push order
 * @param histories    frame histories keyed by agent id
 * @param version      write counter, incremented on every persist
 * @param updatedAt    time of the write
 */
public record PersistedTaskState(
    String taskId,
    String rootAgent,
    String initialInput,
    List<AgentFrame> stack,
    Map<String, HierarchyEntry> hierarchy,
    Map<String, FrameHistoryRecord> histories,
    long version,
    Instant updatedAt
) implements Serializable {

    public PersistedTaskState {
        stack = stack == null ? List.of() : List.copyOf(stack);
        hierarchy = hierarchy == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(hierarchy));
        histories = histories == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(histories));
    }

    /** The root entry of the hierarchy, if any frame was ever pushed. */
    public Optional<HierarchyEntry> rootEntry() {
        return hierarchy.values().stream().filter(e -> e.parentId() == null).findFirst();
    }

    /** Overall status: RUNNING while frames remain on the stack, otherwise the root's status. */
    public FrameStatus taskStatus() {
        if (!stack.isEmpty()) {
            return FrameStatus.RUNNING;
        }
        return rootEntry().map(HierarchyEntry::status).orElse(FrameStatus.RUNNING);
    }
}
