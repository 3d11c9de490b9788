package com.recursa.core.persistence;

import com.recursa.core.model.FrameStatus;
import com.recursa.core.model.HierarchyEntry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only queries over the state store used by the CLI: listing tasks,
 * loading their latest state, and walking the hierarchy index after frames
 * have been popped.
 */
@Service
public class TaskStateQueryService {

    private final StateStore store;

    public TaskStateQueryService(StateStore store) {
        this.store = store;
    }

    public List<String> listTaskIds() {
        return store.listTaskIds();
    }

    public Optional<PersistedTaskState> getLatestState(String taskId) {
        return store.load(taskId);
    }

    public Optional<FrameStatus> taskStatus(String taskId) {
        return store.load(taskId).map(PersistedTaskState::taskStatus);
    }

    /**
     * Returns the hierarchy entries of a task in depth-first order starting at
     * the root, children in spawn order.
     */
    public List<HierarchyEntry> hierarchyTree(String taskId) {
        return store.load(taskId)
                .map(state -> {
                    List<HierarchyEntry> ordered = new ArrayList<>();
                    state.rootEntry().ifPresent(root -> walk(root, state.hierarchy(), ordered));
                    return ordered;
                })
                .orElse(List.of());
    }

    private void walk(HierarchyEntry entry, Map<String, HierarchyEntry> index, List<HierarchyEntry> out) {
        out.add(entry);
        for (String childId : entry.children()) {
            HierarchyEntry child = index.get(childId);
            if (child != null) {
                walk(child, index, out);
            }
        }
    }
}
