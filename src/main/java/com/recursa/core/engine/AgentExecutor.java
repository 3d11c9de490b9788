package com.recursa.core.engine;

import com.recursa.core.config.RuntimeProperties;
import com.recursa.core.consolidation.ConsolidationResult;
import com.recursa.core.context.Prompt;
import com.recursa.core.events.RecursaEvent;
import com.recursa.core.history.ActionHistory;
import com.recursa.core.history.RenderedView;
import com.recursa.core.llm.MalformedModelOutputException;
import com.recursa.core.llm.ModelAuthorizationException;
import com.recursa.core.llm.ModelInvocationException;
import com.recursa.core.logging.MdcContext;
import com.recursa.core.model.Action;
import com.recursa.core.model.ActionRecord;
import com.recursa.core.model.ActionSchema;
import com.recursa.core.model.AgentDefinition;
import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.ConsolidationSnapshot;
import com.recursa.core.model.ExecutorState;
import com.recursa.core.model.FailureReason;
import com.recursa.core.model.FrameResult;
import com.recursa.core.model.HierarchyEntry;
import com.recursa.core.security.CapabilityTable;
import com.recursa.core.tools.ChildRunner;
import com.recursa.core.tools.DispatchOutcome;
import com.recursa.core.tools.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the turn loop of one frame until it emits the final action, fails, or
 * exhausts its turn budget.
 * <p>
 * Each executed action is appended to the frame's history and checkpointed
 * before the next one starts. Every {@code consolidation-interval} actions the
 * rendered history is replaced by a consolidation snapshot; the fact history
 * is never cleared. The executor leaves its own frame on the stack: the
 * parent frame (or the runtime, for the root) pops it after recording the
 * result, so both land in the same write.
 * <p>
 * State store failures and rejected model credentials are not frame failures;
 * they propagate to the runtime and abort the task with the state left
 * resumable.
 */
public class AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutor.class);

    private final TaskSession session;
    private final AgentFrame frame;
    private final ExecutionServices services;
    private final RuntimeProperties properties;
    private final AgentDefinition definition;
    private final ActionHistory history;
    private final ToolDispatcher dispatcher;
    private final List<ActionSchema> schemas;
    private final int consolidationInterval;
    private long actionCounter;
    private ExecutorState state = ExecutorState.AWAITING_DECISION;

    public AgentExecutor(TaskSession session, AgentFrame frame, ExecutionServices services,
                         CapabilityTable capabilities, ChildRunner childRunner) {
        this.session = session;
        this.frame = frame;
        this.services = services;
        this.properties = services.properties();
        this.definition = services.catalog().definitionFor(frame.name());
        this.history = session.historyFor(frame.agentId());
        this.dispatcher = new ToolDispatcher(frame, capabilities, services.catalog(), services.tools(),
                session.hierarchy(), childRunner, Path.of(properties.getWorkspaceRoot()),
                properties.getMaxConsecutiveViolations());
        this.schemas = schemasFor(capabilities);
        this.consolidationInterval = properties.consolidationIntervalFor(frame.level());
        this.actionCounter = history.factCount();
    }

    /**
     * Runs the frame to a terminal result. The frame stays on the stack.
     */
    public FrameResult run() {
        Map<String, String> outerMdc = MdcContext.capture();
        MdcContext.setFrame(session.taskId(), frame);
        long start = System.currentTimeMillis();
        FrameResult result = null;
        try {
            result = loop();
            return result;
        } finally {
            if (result != null) {
                services.metrics().recordFrameDuration(frame.name(), result.status().name(),
                        System.currentTimeMillis() - start);
            }
            MdcContext.restore(outerMdc);
        }
    }

    /**
     * Records the result of a child that finished while this frame was waiting on it,
     * then pops the child. Used when resuming a task whose stack holds the child.
     */
    public void recordChildResult(AgentFrame child, FrameResult result) {
        Map<String, String> outerMdc = MdcContext.capture();
        MdcContext.setFrame(session.taskId(), frame);
        try {
            record(new Action(child.name(), child.arguments()), DispatchOutcome.fromChild(result));
        } finally {
            MdcContext.restore(outerMdc);
        }
    }

    private FrameResult loop() {
        Optional<ActionRecord> finished = recordedFinalAction();
        if (finished.isPresent()) {
            log.info("{} already emitted its final action, completing", frame.agentId());
            return complete(finished.get().result());
        }
        try {
            planIfFresh();
            consolidateIfOverdue();
            while (history.turnsCompleted() < properties.getMaxTurns()) {
                if (session.cancelled()) {
                    throw new FrameFailure(FailureReason.CANCELLED, "Task cancelled");
                }
                state = ExecutorState.AWAITING_DECISION;
                List<Action> actions = decide();

                state = ExecutorState.EXECUTING_ACTIONS;
                for (int i = 0; i < actions.size(); i++) {
                    Action action = actions.get(i);
                    DispatchOutcome outcome = dispatcher.dispatch(action);
                    record(action, outcome);
                    if (outcome.kind() == DispatchOutcome.Kind.FINAL) {
                        if (i < actions.size() - 1) {
                            log.warn("Ignoring {} action(s) after the final action", actions.size() - 1 - i);
                        }
                        return complete(outcome.result());
                    }
                    if (outcome.violationLimitExceeded()) {
                        throw new FrameFailure(FailureReason.CAPABILITY_VIOLATION,
                                "More than " + properties.getMaxConsecutiveViolations()
                                        + " consecutive capability violations; last: " + outcome.error());
                    }
                }
                history.recordTurn();
                session.checkpoint();
            }
            throw new FrameFailure(FailureReason.TURN_BUDGET_EXCEEDED,
                    "Turn budget of " + properties.getMaxTurns() + " exhausted without a final output");
        } catch (FrameFailure f) {
            return fail(f.reason(), f.getMessage());
        }
    }

    /**
     * Catches up on a consolidation boundary that was reached but whose snapshot was never
     * persisted, as when a crash hits between the boundary action and the snapshot write.
     */
    private void consolidateIfOverdue() {
        if (history.rendered().size() >= consolidationInterval) {
            log.info("{} resumed with {} unconsolidated entries, consolidating before the next decision",
                    frame.agentId(), history.rendered().size());
            consolidate();
        }
    }

    private void planIfFresh() {
        if (!properties.isInitialPlanning() || history.factCount() > 0 || history.turnsCompleted() > 0
                || history.latestSnapshot().isPresent()) {
            return;
        }
        state = ExecutorState.CONSOLIDATING;
        services.consolidationAgent().plan(frame, definition, schemas).ifPresent(plan -> {
            history.resetTo(plan);
            session.hierarchy().updateProgress(frame.agentId(), plan.summary());
            log.info("Initial plan for {}: {}", frame.agentId(), plan.summary());
        });
    }

    private List<Action> decide() {
        int malformed = 0;
        while (true) {
            RenderedView view = history.renderedView();
            Prompt prompt = services.contextBuilder().build(frame, definition.instructions(),
                    view.snapshot(), view.entries(), hierarchyView());
            if (prompt.droppedEntries() > 0) {
                log.debug("Prompt for {} omits {} oldest entries", frame.agentId(), prompt.droppedEntries());
            }
            try {
                List<Action> actions = services.modelInvoker().invoke(prompt, schemas);
                if (actions == null || actions.isEmpty()) {
                    throw new MalformedModelOutputException("Model returned no actions");
                }
                return actions;
            } catch (ModelAuthorizationException e) {
                throw e;
            } catch (MalformedModelOutputException e) {
                malformed++;
                services.metrics().recordMalformedOutput();
                if (malformed > properties.getMaxMalformedRetries()) {
                    throw new FrameFailure(FailureReason.MALFORMED_MODEL_OUTPUT,
                            "Model output malformed " + malformed + " times in a row: " + e.getMessage());
                }
                log.warn("Malformed model output for {} ({}/{}), asking again: {}", frame.agentId(),
                        malformed, properties.getMaxMalformedRetries(), e.getMessage());
            } catch (ModelInvocationException e) {
                throw new FrameFailure(FailureReason.TRANSIENT_MODEL_ERROR, e.getMessage());
            }
        }
    }

    private void record(Action action, DispatchOutcome outcome) {
        long seq = history.nextSequenceNo();
        ActionRecord entry = outcome.failed()
                ? ActionRecord.failure(seq, action, outcome.errorReason(), outcome.error())
                : ActionRecord.success(seq, action, outcome.result());
        history.append(entry);
        if (outcome.childResult() != null) {
            popChild(outcome.childResult());
        } else {
            session.checkpoint();
        }
        actionCounter++;
        services.metrics().recordAction(outcome.kind().name().toLowerCase(), outcome.failed());
        if (outcome.kind() == DispatchOutcome.Kind.VIOLATION) {
            services.metrics().recordCapabilityViolation(frame.name());
            publish("capability.violation", Map.of("action", action.name(), "error", outcome.error()));
        }
        if (outcome.kind() != DispatchOutcome.Kind.FINAL && actionCounter % consolidationInterval == 0) {
            consolidate();
        }
    }

    private void popChild(FrameResult child) {
        AgentFrame top = session.hierarchy().top().orElse(null);
        if (top == null || !top.agentId().equals(child.agentId())) {
            throw new IllegalStateException("Child " + child.agentId() + " is not on top of the stack");
        }
        String output = child.completed() ? child.payload() : "[" + child.reason() + "] " + child.detail();
        session.hierarchy().pop(child.status(), output);
        services.eventBus().publish(RecursaEvent.of("frame.popped", session.taskId(), child.agentId(),
                Map.of("status", child.status().name())));
    }

    private void consolidate() {
        state = ExecutorState.CONSOLIDATING;
        ConsolidationResult result = services.consolidationAgent().consolidate(frame, definition, schemas,
                history.latestSnapshot().orElse(null), history.rendered(), history.lastSequenceNo());
        history.resetTo(result.snapshot());
        session.hierarchy().updateProgress(frame.agentId(), result.snapshot().summary());
        services.metrics().recordConsolidation(result.degraded());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("throughSequence", result.snapshot().throughSequence());
        payload.put("summary", result.snapshot().summary());
        if (result.degraded()) {
            payload.put("reason", FailureReason.CONSOLIDATION_DEGRADED.name());
            payload.put("failure", String.valueOf(result.failure()));
            publish("consolidation.degraded", payload);
        } else {
            publish("consolidation.completed", payload);
        }
        state = ExecutorState.EXECUTING_ACTIONS;
    }

    private FrameResult complete(String payload) {
        state = ExecutorState.COMPLETED;
        log.info("{} completed", frame.agentId());
        return FrameResult.completed(frame.agentId(), payload);
    }

    private FrameResult fail(FailureReason reason, String detail) {
        state = ExecutorState.FAILED;
        String full = detail + history.latestSnapshot()
                .map(s -> "; last progress: " + s.summary())
                .orElse("");
        log.warn("{} failed [{}]: {}", frame.agentId(), reason, full);
        return FrameResult.failed(frame.agentId(), reason, full);
    }

    private Optional<ActionRecord> recordedFinalAction() {
        List<ActionRecord> facts = history.facts();
        if (facts.isEmpty()) {
            return Optional.empty();
        }
        ActionRecord last = facts.get(facts.size() - 1);
        return last.actionName().equals(properties.getFinalAction()) && !last.failed()
                ? Optional.of(last) : Optional.empty();
    }

    private List<HierarchyEntry> hierarchyView() {
        return new ArrayList<>(session.hierarchy().index().values());
    }

    private List<ActionSchema> schemasFor(CapabilityTable capabilities) {
        List<ActionSchema> result = new ArrayList<>();
        for (String name : capabilities.permittedActions(frame.level(), frame.name())) {
            if (name.equals(capabilities.finalAction())) {
                result.add(new ActionSchema(name, "Finish and return the result to the caller",
                        List.of("output"), ActionSchema.Kind.FINAL));
            } else if (services.catalog().isAgent(name)) {
                result.add(new ActionSchema(name, services.catalog().definitionFor(name).description(),
                        List.of("task"), ActionSchema.Kind.AGENT));
            } else {
                result.add(new ActionSchema(name, services.tools().describe(name).orElse(""),
                        List.of(), ActionSchema.Kind.TOOL));
            }
        }
        return result;
    }

    private void publish(String type, Map<String, Object> payload) {
        services.eventBus().publish(RecursaEvent.of(type, session.taskId(), frame.agentId(), payload));
    }

    public ExecutorState state() {
        return state;
    }

    public AgentFrame frame() {
        return frame;
    }

    ConsolidationSnapshot latestSnapshot() {
        return history.latestSnapshot().orElse(null);
    }
}
