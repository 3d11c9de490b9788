package com.recursa.core.engine;

import com.recursa.core.config.RuntimeProperties;
import com.recursa.core.events.EventBus;
import com.recursa.core.events.RecursaEvent;
import com.recursa.core.llm.ModelAuthorizationException;
import com.recursa.core.logging.MdcContext;
import com.recursa.core.metrics.RecursaMetrics;
import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.FailureReason;
import com.recursa.core.model.FrameResult;
import com.recursa.core.model.FrameStatus;
import com.recursa.core.model.HierarchyEntry;
import com.recursa.core.model.TaskOutcome;
import com.recursa.core.persistence.PersistedTaskState;
import com.recursa.core.persistence.StateStore;
import com.recursa.core.persistence.StateStoreException;
import com.recursa.core.security.CapabilityProperties;
import com.recursa.core.security.CapabilityTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Entry point for running tasks: starts a root frame, resumes a persisted stack
 * from its top frame down, and cancels running tasks.
 * <p>
 * Both {@code start} and {@code resume} always return a {@link TaskOutcome}.
 * State store failures and rejected model credentials abort the task with the
 * last persisted state left in place so it can be resumed later.
 */
@Service
public class AgentRuntime {

    private static final Logger log = LoggerFactory.getLogger(AgentRuntime.class);

    private final StateStore store;
    private final ExecutionServices services;
    private final CapabilityProperties capabilityProperties;
    private final RuntimeProperties properties;
    private final EventBus eventBus;
    private final RecursaMetrics metrics;
    private final Map<String, TaskSession> active = new ConcurrentHashMap<>();

    public AgentRuntime(StateStore store, ExecutionServices services, CapabilityProperties capabilityProperties) {
        this.store = store;
        this.services = services;
        this.capabilityProperties = capabilityProperties;
        this.properties = services.properties();
        this.eventBus = services.eventBus();
        this.metrics = services.metrics();
    }

    /**
     * Starts a task under an id derived from the root agent and the input.
     */
    public TaskOutcome start(String initialInput) {
        return start(taskIdFor(initialInput), initialInput);
    }

    /**
     * The id {@link #start(String)} uses for {@code initialInput}.
     */
    public String taskIdFor(String initialInput) {
        return deriveTaskId(properties.getRootAgent(), initialInput);
    }

    /**
     * Starts {@code taskId}. If state for the id already exists, an unfinished task is
     * resumed and a finished one returns its recorded outcome.
     */
    public TaskOutcome start(String taskId, String initialInput) {
        if (active.containsKey(taskId)) {
            return alreadyRunning(taskId);
        }
        MdcContext.setTask(taskId);
        try {
            Optional<PersistedTaskState> existing = load(taskId);
            if (existing.isPresent()) {
                PersistedTaskState state = existing.get();
                if (state.taskStatus() == FrameStatus.RUNNING && !state.stack().isEmpty()) {
                    log.info("Task {} already exists and is unfinished, resuming", taskId);
                    return resumeState(state);
                }
                if (!state.hierarchy().isEmpty()) {
                    log.info("Task {} already finished with {}", taskId, state.taskStatus());
                    return outcomeOf(state);
                }
            }
            TaskSession session = TaskSession.create(taskId, properties.getRootAgent(), initialInput,
                    store, properties.getMaxDepth());
            return execute(session, () -> {
                AgentFrame root = session.hierarchy().push(null, properties.getRootAgent(), initialInput, Map.of());
                log.info("Task {} started with root {}", taskId, root.agentId());
                eventBus.publish(RecursaEvent.of("task.started", taskId, root.agentId(),
                        Map.of("rootAgent", root.name(), "input", initialInput)));
                eventBus.publish(RecursaEvent.of("frame.pushed", taskId, root.agentId(),
                        Map.of("name", root.name(), "level", 0)));
                FrameResult result = newFactory(session).create(root).run();
                return finishRoot(session, result);
            });
        } catch (StateStoreException e) {
            return failed(TaskOutcome.failed(taskId, null, FailureReason.STATE_STORE_IO_ERROR,
                    e.getMessage(), List.of()));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Resumes a persisted task from the top of its stack. Children are finished first and
     * their results recorded in their parents, down to the root.
     */
    public TaskOutcome resume(String taskId) {
        if (active.containsKey(taskId)) {
            return alreadyRunning(taskId);
        }
        MdcContext.setTask(taskId);
        try {
            Optional<PersistedTaskState> state = load(taskId);
            if (state.isEmpty()) {
                log.warn("No persisted state for task {}", taskId);
                return TaskOutcome.failed(taskId, null, FailureReason.UNKNOWN_TASK,
                        "No persisted state for task " + taskId, List.of());
            }
            if (state.get().stack().isEmpty()) {
                return outcomeOf(state.get());
            }
            return resumeState(state.get());
        } catch (StateStoreException e) {
            return failed(TaskOutcome.failed(taskId, null, FailureReason.STATE_STORE_IO_ERROR,
                    e.getMessage(), List.of()));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Requests cancellation of a running task. Frames stop at their next turn boundary.
     *
     * @return true if the task was running in this process
     */
    public boolean cancel(String taskId) {
        TaskSession session = active.get(taskId);
        if (session == null) {
            return false;
        }
        log.info("Cancellation requested for task {}", taskId);
        session.cancel();
        return true;
    }

    public boolean isRunning(String taskId) {
        return active.containsKey(taskId);
    }

    private TaskOutcome resumeState(PersistedTaskState state) {
        TaskSession session = TaskSession.restore(state, store, properties.getMaxDepth());
        return execute(session, () -> {
            AgentExecutorFactory factory = newFactory(session);
            List<AgentFrame> stack = session.hierarchy().stack();
            AgentFrame top = stack.get(stack.size() - 1);
            log.info("Resuming task {} at {} (depth {})", session.taskId(), top.agentId(), stack.size());
            FrameResult result = factory.create(top).run();
            while (session.hierarchy().depth() > 1) {
                List<AgentFrame> current = session.hierarchy().stack();
                AgentFrame child = current.get(current.size() - 1);
                AgentExecutor parent = factory.create(current.get(current.size() - 2));
                parent.recordChildResult(child, result);
                result = parent.run();
            }
            return finishRoot(session, result);
        });
    }

    private TaskOutcome execute(TaskSession session, Supplier<TaskOutcome> body) {
        if (active.putIfAbsent(session.taskId(), session) != null) {
            return alreadyRunning(session.taskId());
        }
        try {
            return body.get();
        } catch (ModelAuthorizationException e) {
            log.error("Task {} aborted: model credentials rejected: {}", session.taskId(), e.getMessage());
            return abort(session, FailureReason.MODEL_AUTHORIZATION, e.getMessage());
        } catch (StateStoreException e) {
            log.error("Task {} aborted: state store failure: {}", session.taskId(), e.getMessage(), e);
            return abort(session, FailureReason.STATE_STORE_IO_ERROR, e.getMessage());
        } finally {
            active.remove(session.taskId());
        }
    }

    private TaskOutcome finishRoot(TaskSession session, FrameResult result) {
        String output = result.completed() ? result.payload() : "[" + result.reason() + "] " + result.detail();
        AgentFrame root = session.hierarchy().pop(result.status(), output);
        if (result.completed()) {
            return completed(TaskOutcome.completed(session.taskId(), root.agentId(), result.payload()));
        }
        return failed(TaskOutcome.failed(session.taskId(), root.agentId(), result.reason(), result.detail(),
                session.historyFor(root.agentId()).facts()));
    }

    private TaskOutcome abort(TaskSession session, FailureReason reason, String detail) {
        String rootId = session.hierarchy().stack().isEmpty()
                ? session.hierarchy().index().keySet().stream().findFirst().orElse(null)
                : session.hierarchy().stack().get(0).agentId();
        return failed(TaskOutcome.failed(session.taskId(), rootId, reason, detail,
                rootId != null ? session.historyFor(rootId).facts() : List.of()));
    }

    /**
     * Rejects a second start or resume of a task running in this process. The running
     * task and its persisted state are left alone.
     */
    private TaskOutcome alreadyRunning(String taskId) {
        log.warn("Task {} is already running; start/resume rejected", taskId);
        return TaskOutcome.failed(taskId, null, FailureReason.TASK_ALREADY_RUNNING,
                "Task " + taskId + " is already running", List.of());
    }

    private TaskOutcome outcomeOf(PersistedTaskState state) {
        HierarchyEntry root = state.rootEntry().orElse(null);
        if (root == null) {
            return TaskOutcome.failed(state.taskId(), null, FailureReason.UNKNOWN_TASK,
                    "Task " + state.taskId() + " has no root frame", List.of());
        }
        if (root.status() == FrameStatus.COMPLETED) {
            return TaskOutcome.completed(state.taskId(), root.agentId(), root.finalOutput());
        }
        var facts = Optional.ofNullable(state.histories().get(root.agentId()))
                .map(h -> h.facts())
                .orElse(List.of());
        return TaskOutcome.failed(state.taskId(), root.agentId(), reasonOf(root.finalOutput()),
                detailOf(root.finalOutput()), facts);
    }

    private TaskOutcome completed(TaskOutcome outcome) {
        log.info("Task {} completed", outcome.taskId());
        metrics.recordTaskResult("completed");
        eventBus.publish(RecursaEvent.of("task.completed", outcome.taskId(), outcome.rootAgentId(),
                Map.of("payload", outcome.payload() != null ? outcome.payload() : "")));
        return outcome;
    }

    private TaskOutcome failed(TaskOutcome outcome) {
        log.warn("Task {} failed [{}]: {}", outcome.taskId(), outcome.reason(), outcome.detail());
        metrics.recordTaskResult("failed");
        eventBus.publish(RecursaEvent.of("task.failed", outcome.taskId(), outcome.rootAgentId(),
                Map.of("reason", String.valueOf(outcome.reason()),
                        "detail", outcome.detail() != null ? outcome.detail() : "")));
        return outcome;
    }

    private Optional<PersistedTaskState> load(String taskId) {
        try {
            return store.load(taskId);
        } catch (StateStoreException e) {
            log.error("Cannot load state of task {}: {}", taskId, e.getMessage(), e);
            throw e;
        }
    }

    private AgentExecutorFactory newFactory(TaskSession session) {
        return new AgentExecutorFactory(session, services,
                CapabilityTable.from(capabilityProperties, properties.getFinalAction()));
    }

    /**
     * Deterministic task id: 8 hex chars of md5(rootAgent|input) and a slug of the input.
     */
    public static String deriveTaskId(String rootAgent, String input) {
        String hash = DigestUtils.md5DigestAsHex((rootAgent + "|" + input).getBytes(StandardCharsets.UTF_8))
                .substring(0, 8);
        String slug = input == null ? "" : input.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > 32) {
            slug = slug.substring(0, 32).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? hash + "_task" : hash + "_" + slug;
    }

    static FailureReason reasonOf(String finalOutput) {
        if (finalOutput != null && finalOutput.startsWith("[")) {
            int end = finalOutput.indexOf(']');
            if (end > 1) {
                try {
                    return FailureReason.valueOf(finalOutput.substring(1, end));
                } catch (IllegalArgumentException e) {
                    log.debug("Unrecognised failure reason in '{}'", finalOutput);
                }
            }
        }
        return null;
    }

    static String detailOf(String finalOutput) {
        if (reasonOf(finalOutput) == null) {
            return finalOutput;
        }
        return finalOutput.substring(finalOutput.indexOf(']') + 1).strip();
    }
}
