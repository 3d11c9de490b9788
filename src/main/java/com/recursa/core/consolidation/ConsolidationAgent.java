package com.recursa.core.consolidation;

import com.recursa.core.config.RuntimeProperties;
import com.recursa.core.context.PromptSections;
import com.recursa.core.llm.LlmService;
import com.recursa.core.llm.MalformedModelOutputException;
import com.recursa.core.llm.ModelAuthorizationException;
import com.recursa.core.llm.ModelErrorClassifier;
import com.recursa.core.llm.ModelInvocationException;
import com.recursa.core.model.ActionRecord;
import com.recursa.core.model.ActionSchema;
import com.recursa.core.model.AgentDefinition;
import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.ConsolidationSnapshot;
import com.recursa.core.model.TodoItem;
import com.recursa.core.model.TodoStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Compresses a frame's rendered history into a {@link ConsolidationSnapshot}.
 * <p>
 * Never touches any history itself; the caller applies the returned snapshot.
 * When the model keeps failing, a degraded snapshot is produced that keeps the
 * previous snapshot's fields and carries the unconsolidated entries as raw text,
 * so no progress is lost. Authorization failures are not retried and propagate.
 */
@Service
public class ConsolidationAgent {

    private static final Logger log = LoggerFactory.getLogger(ConsolidationAgent.class);

    static final String SYSTEM_PROMPT = """
            You manage the working context of an autonomous agent. The agent's action history is about \
            to be discarded; everything it will still need must be in your answer.
            If <progress_snapshot> is empty this is the first plan for the task; otherwise update it.

            Produce:
            - todoList: the task broken into concrete items, each with status done, ongoing or waiting. \
            Ongoing items carry notes about partial progress.
            - fileDescriptions: workspace files that matter from now on, one per line as path: purpose.
            - durableFacts: the workspace layout, rules from the user and any content the next steps \
            depend on. This is the only information that survives the reset.
            - nextSteps: a numbered, tool-level plan concrete enough to execute without the history.
            Answer in the language of <task_input>.
            """;

    private final LlmService llmService;
    private final int maxRetries;
    private final int maxResultChars;
    private final int maxCarriedChars;

    @Autowired
    public ConsolidationAgent(LlmService llmService, RuntimeProperties properties) {
        this(llmService, properties.getMaxConsolidationRetries(), properties.getActionResultMaxChars(),
                properties.getRenderedHistoryMaxChars());
    }

    public ConsolidationAgent(LlmService llmService, int maxRetries, int maxResultChars) {
        this(llmService, maxRetries, maxResultChars, Integer.MAX_VALUE);
    }

    public ConsolidationAgent(LlmService llmService, int maxRetries, int maxResultChars, int maxCarriedChars) {
        this.llmService = llmService;
        this.maxRetries = Math.max(0, maxRetries);
        this.maxResultChars = maxResultChars;
        this.maxCarriedChars = maxCarriedChars;
    }

    /**
     * Consolidates {@code tail} (the rendered entries since {@code previous}) into a new snapshot
     * covering the fact history through {@code throughSequence}.
     */
    public ConsolidationResult consolidate(AgentFrame frame, AgentDefinition definition,
                                           List<ActionSchema> actions, ConsolidationSnapshot previous,
                                           List<ActionRecord> tail, long throughSequence) {
        String userPrompt = buildUserPrompt(frame, definition, actions, previous, tail);
        String lastFailure = null;
        int attempts = 0;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            attempts++;
            try {
                SnapshotDraft draft = callModel(userPrompt);
                ConsolidationSnapshot snapshot = toSnapshot(draft, throughSequence);
                log.info("Consolidated {} entries of {} through #{} ({})", tail.size(), frame.agentId(),
                        throughSequence, snapshot.summary());
                return new ConsolidationResult(snapshot, attempts, null);
            } catch (ModelAuthorizationException e) {
                throw e;
            } catch (ModelInvocationException e) {
                lastFailure = e.getMessage();
                log.warn("Consolidation attempt {}/{} for {} failed: {}", attempt + 1, maxRetries + 1,
                        frame.agentId(), e.getMessage());
            }
        }
        log.warn("Consolidation for {} degraded after {} attempt(s); carrying {} raw entries",
                frame.agentId(), attempts, tail.size());
        return new ConsolidationResult(degraded(previous, tail, throughSequence), attempts, lastFailure);
    }

    /**
     * Initial plan for a frame that has no history yet. Empty when the model fails.
     */
    public Optional<ConsolidationSnapshot> plan(AgentFrame frame, AgentDefinition definition,
                                                List<ActionSchema> actions) {
        String userPrompt = buildUserPrompt(frame, definition, actions, null, List.of());
        try {
            return Optional.of(toSnapshot(callModel(userPrompt), 0L));
        } catch (ModelAuthorizationException e) {
            throw e;
        } catch (ModelInvocationException e) {
            log.warn("Initial planning for {} failed, continuing without a plan: {}",
                    frame.agentId(), e.getMessage());
            return Optional.empty();
        }
    }

    ConsolidationSnapshot degraded(ConsolidationSnapshot previous, List<ActionRecord> tail, long throughSequence) {
        ConsolidationSnapshot base = previous != null ? previous : ConsolidationSnapshot.empty();
        String raw = tail.stream()
                .map(r -> PromptSections.record(r, maxResultChars))
                .collect(Collectors.joining("\n"));
        String carried = base.carriedOver().isBlank() ? raw : base.carriedOver() + "\n" + raw;
        if (carried.length() > maxCarriedChars) {
            carried = carried.substring(carried.length() - maxCarriedChars);
            int lineStart = carried.indexOf('\n');
            if (lineStart >= 0) {
                carried = carried.substring(lineStart + 1);
            }
        }
        return new ConsolidationSnapshot(base.todoItems(), base.durableFacts(), base.nextStepPlan(),
                carried, true, throughSequence, Instant.now());
    }

    private SnapshotDraft callModel(String userPrompt) {
        try {
            return llmService.structuredCall(SYSTEM_PROMPT, userPrompt, SnapshotDraft.class);
        } catch (RuntimeException e) {
            throw ModelErrorClassifier.classify(e);
        }
    }

    private String buildUserPrompt(AgentFrame frame, AgentDefinition definition, List<ActionSchema> actions,
                                   ConsolidationSnapshot previous, List<ActionRecord> tail) {
        var sb = new StringBuilder();
        sb.append("<agent_instructions>\n").append(definition.instructions().strip())
          .append("\n</agent_instructions>\n\n");
        sb.append(PromptSections.identity(frame)).append("\n\n");
        sb.append("<available_actions>\n");
        for (ActionSchema schema : actions) {
            sb.append("- ").append(schema.name());
            if (!schema.parameters().isEmpty()) {
                sb.append("(").append(String.join(", ", schema.parameters())).append(")");
            }
            sb.append("\n");
        }
        sb.append("</available_actions>\n\n");
        sb.append(PromptSections.snapshot(previous, maxCarriedChars)).append("\n\n");
        sb.append(PromptSections.records(tail.stream()
                .map(r -> PromptSections.record(r, maxResultChars))
                .collect(Collectors.toList()))).append("\n\n");
        sb.append("<task_input>\n").append(frame.input() != null ? frame.input().strip() : "")
          .append("\n</task_input>");
        return sb.toString();
    }

    static ConsolidationSnapshot toSnapshot(SnapshotDraft draft, long throughSequence) {
        if (draft == null) {
            throw new MalformedModelOutputException("Consolidation answer was empty");
        }
        if (draft.nextSteps() == null || draft.nextSteps().isBlank()) {
            throw new MalformedModelOutputException("Consolidation answer has no next steps");
        }
        List<TodoItem> items = new ArrayList<>();
        if (draft.todoList() != null) {
            for (SnapshotDraft.TodoDraft todo : draft.todoList()) {
                if (todo == null || todo.text() == null || todo.text().isBlank()) {
                    throw new MalformedModelOutputException("Consolidation answer has a todo item without text");
                }
                String text = todo.text().strip();
                if (todo.notes() != null && !todo.notes().isBlank()) {
                    text = text + " (" + todo.notes().strip() + ")";
                }
                items.add(new TodoItem(text, parseStatus(todo.status())));
            }
        }
        var facts = new StringBuilder();
        if (draft.fileDescriptions() != null && !draft.fileDescriptions().isBlank()) {
            facts.append("files:\n").append(draft.fileDescriptions().strip()).append("\n");
        }
        if (draft.durableFacts() != null && !draft.durableFacts().isBlank()) {
            facts.append(draft.durableFacts().strip());
        }
        return new ConsolidationSnapshot(items, facts.toString().strip(), draft.nextSteps().strip(),
                "", false, throughSequence, Instant.now());
    }

    private static TodoStatus parseStatus(String status) {
        if (status == null) {
            throw new MalformedModelOutputException("Consolidation answer has a todo item without status");
        }
        String s = status.strip().toLowerCase(Locale.ROOT).replaceFirst("^\\[", "");
        if (s.startsWith("done")) {
            return TodoStatus.DONE;
        }
        if (s.startsWith("ongoing")) {
            return TodoStatus.ONGOING;
        }
        if (s.startsWith("waiting")) {
            return TodoStatus.WAITING;
        }
        throw new MalformedModelOutputException("Unknown todo status: " + status);
    }
}
