package com.recursa.core.engine;

import com.recursa.core.hierarchy.HierarchyStackManager;
import com.recursa.core.history.ActionHistory;
import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.HierarchyEntry;
import com.recursa.core.persistence.FrameHistoryRecord;
import com.recursa.core.persistence.PersistedTaskState;
import com.recursa.core.persistence.StateStore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory state of one running task: its stack, hierarchy index and frame
 * histories, bound to the store they are checkpointed to.
 * <p>
 * Every stack change is written before it becomes visible, and every recorded
 * action is followed by {@link #checkpoint()}, so the persisted document always
 * reflects the last completed step.
 */
public class TaskSession {

    private final String taskId;
    private final String rootAgent;
    private final String initialInput;
    private final StateStore store;
    private final Map<String, ActionHistory> histories = new LinkedHashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final HierarchyStackManager hierarchy;
    private long version;

    private TaskSession(String taskId, String rootAgent, String initialInput, StateStore store,
                        int maxDepth, PersistedTaskState restored) {
        this.taskId = taskId;
        this.rootAgent = rootAgent;
        this.initialInput = initialInput;
        this.store = store;
        if (restored == null) {
            this.hierarchy = new HierarchyStackManager(taskId, maxDepth, this::write);
        } else {
            this.version = restored.version();
            restored.histories().forEach((id, record) -> histories.put(id, record.toHistory()));
            this.hierarchy = new HierarchyStackManager(taskId, maxDepth, this::write,
                    restored.stack(), restored.hierarchy());
        }
    }

    public static TaskSession create(String taskId, String rootAgent, String initialInput,
                                     StateStore store, int maxDepth) {
        return new TaskSession(taskId, rootAgent, initialInput, store, maxDepth, null);
    }

    public static TaskSession restore(PersistedTaskState state, StateStore store, int maxDepth) {
        return new TaskSession(state.taskId(), state.rootAgent(), state.initialInput(), store, maxDepth, state);
    }

    /**
     * The history of {@code agentId}, created empty on first access.
     */
    public ActionHistory historyFor(String agentId) {
        return histories.computeIfAbsent(agentId, ActionHistory::new);
    }

    /**
     * Persists the current stack, index and histories.
     *
     * @throws com.recursa.core.persistence.StateStoreException if the write fails
     */
    public void checkpoint() {
        write(hierarchy.stack(), hierarchy.index());
    }

    public PersistedTaskState toState() {
        return buildState(hierarchy.stack(), hierarchy.index(), version);
    }

    private void write(List<AgentFrame> stack, Map<String, HierarchyEntry> index) {
        PersistedTaskState state = buildState(stack, index, version + 1);
        store.persist(taskId, state);
        version = state.version();
    }

    private PersistedTaskState buildState(List<AgentFrame> stack, Map<String, HierarchyEntry> index, long v) {
        Map<String, FrameHistoryRecord> records = new LinkedHashMap<>();
        histories.forEach((id, history) -> records.put(id, FrameHistoryRecord.of(history)));
        return new PersistedTaskState(taskId, rootAgent, initialInput, stack, index, records, v, Instant.now());
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean cancelled() {
        return cancelled.get();
    }

    public HierarchyStackManager hierarchy() {
        return hierarchy;
    }

    public String taskId() {
        return taskId;
    }

    public String rootAgent() {
        return rootAgent;
    }

    public String initialInput() {
        return initialInput;
    }

    public long version() {
        return version;
    }
}
