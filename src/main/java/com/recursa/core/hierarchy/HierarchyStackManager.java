package com.recursa.core.hierarchy;

import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.FrameStatus;
import com.recursa.core.model.HierarchyEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maintains the active frame stack of one task and the hierarchy index that
 * outlives popped frames.
 * <p>
 * Every mutation is staged on copies, handed to the {@link HierarchyWriter},
 * and only made visible once the write returned. A failed write leaves the
 * manager exactly as it was.
 */
public class HierarchyStackManager {

    private static final Logger log = LoggerFactory.getLogger(HierarchyStackManager.class);

    private final String taskId;
    private final int maxDepth;
    private final HierarchyWriter writer;

    private List<AgentFrame> stack;
    private Map<String, HierarchyEntry> index;

    public HierarchyStackManager(String taskId, int maxDepth, HierarchyWriter writer) {
        this(taskId, maxDepth, writer, List.of(), Map.of());
    }

    /**
     * Restores a manager from persisted state.
     *
     * @throws IllegalStateException if the restored stack breaks the parent/level chain
     */
    public HierarchyStackManager(String taskId, int maxDepth, HierarchyWriter writer,
                                 List<AgentFrame> stack, Map<String, HierarchyEntry> index) {
        this.taskId = Objects.requireNonNull(taskId, "taskId must not be null");
        this.maxDepth = maxDepth;
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        if (!StackInvariant.holds(stack)) {
            throw new IllegalStateException("Restored stack of task " + taskId + " breaks the parent/level chain");
        }
        this.stack = List.copyOf(stack);
        this.index = Collections.unmodifiableMap(new LinkedHashMap<>(index));
    }

    /**
     * Pushes a new frame on top of {@code parentId}.
     *
     * @param parentId  current top frame id, or null to push the root onto an empty stack
     * @param name      agent name
     * @param input     task input for the new agent
     * @param arguments arguments of the spawning action
     * @return the new frame, already persisted
     * @throws DepthExceededException if the new level would exceed the maximum depth
     * @throws IllegalStateException  if {@code parentId} is not the current top
     */
    public AgentFrame push(String parentId, String name, String input, Map<String, Object> arguments) {
        AgentFrame top = stack.isEmpty() ? null : stack.get(stack.size() - 1);
        if (parentId == null && top != null) {
            throw new IllegalStateException("Task " + taskId + " already has root frame " + stack.get(0).agentId());
        }
        if (parentId != null && (top == null || !top.agentId().equals(parentId))) {
            throw new IllegalStateException("Parent " + parentId + " is not the top of the stack of task " + taskId);
        }
        int level = top == null ? 0 : top.level() + 1;
        if (level > maxDepth) {
            throw new DepthExceededException(level, maxDepth);
        }

        var frame = new AgentFrame(agentIdFor(name, input), name, parentId, level, input, arguments,
                FrameStatus.RUNNING, Instant.now());

        var newStack = new ArrayList<>(stack);
        newStack.add(frame);
        var newIndex = new LinkedHashMap<>(index);
        newIndex.put(frame.agentId(), HierarchyEntry.of(frame));
        if (parentId != null) {
            newIndex.computeIfPresent(parentId, (id, entry) -> entry.withChild(frame.agentId()));
        }

        commit(newStack, newIndex);
        log.info("Pushed {} (level {}, parent {})", frame.agentId(), level, parentId);
        return frame;
    }

    /**
     * Pops the top frame, recording its final status and output in the index.
     *
     * @return the popped frame with its status finalized
     * @throws IllegalStateException if the stack is empty or {@code status} is RUNNING
     */
    public AgentFrame pop(FrameStatus status, String finalOutput) {
        if (stack.isEmpty()) {
            throw new IllegalStateException("Cannot pop: stack of task " + taskId + " is empty");
        }
        if (status == FrameStatus.RUNNING) {
            throw new IllegalStateException("A popped frame must be COMPLETED or FAILED");
        }
        AgentFrame finished = stack.get(stack.size() - 1).withStatus(status);

        var newStack = new ArrayList<>(stack.subList(0, stack.size() - 1));
        var newIndex = new LinkedHashMap<>(index);
        newIndex.computeIfPresent(finished.agentId(), (id, entry) -> entry.finished(status, finalOutput));

        commit(newStack, newIndex);
        log.info("Popped {} with status {}", finished.agentId(), status);
        return finished;
    }

    /**
     * Records a progress summary on an agent's index entry.
     */
    public void updateProgress(String agentId, String summary) {
        if (!index.containsKey(agentId)) {
            return;
        }
        var newIndex = new LinkedHashMap<>(index);
        newIndex.computeIfPresent(agentId, (id, entry) -> entry.withProgress(summary));
        commit(stack, newIndex);
    }

    public Optional<AgentFrame> top() {
        return stack.isEmpty() ? Optional.empty() : Optional.of(stack.get(stack.size() - 1));
    }

    public List<AgentFrame> stack() {
        return stack;
    }

    public Map<String, HierarchyEntry> index() {
        return index;
    }

    public Optional<HierarchyEntry> entry(String agentId) {
        return Optional.ofNullable(index.get(agentId));
    }

    public int depth() {
        return stack.size();
    }

    public int maxDepth() {
        return maxDepth;
    }

    public String taskId() {
        return taskId;
    }

    private void commit(List<AgentFrame> newStack, Map<String, HierarchyEntry> newIndex) {
        var frozenStack = List.copyOf(newStack);
        var frozenIndex = Collections.unmodifiableMap(new LinkedHashMap<>(newIndex));
        writer.write(frozenStack, frozenIndex);
        this.stack = frozenStack;
        this.index = frozenIndex;
    }

    /**
     * {@code <name>_<12 hex of md5(name|task|input|ordinal)>}; the ordinal keeps
     * repeated spawns with identical input distinct within one task.
     */
    private String agentIdFor(String name, String input) {
        String content = name + "|" + taskId + "|" + (input != null ? input : "") + "|" + index.size();
        String hash = DigestUtils.md5DigestAsHex(content.getBytes(StandardCharsets.UTF_8));
        return name + "_" + hash.substring(0, 12);
    }
}
