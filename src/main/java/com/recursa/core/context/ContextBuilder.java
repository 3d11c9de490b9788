package com.recursa.core.context;

import com.recursa.core.config.RuntimeProperties;
import com.recursa.core.model.ActionRecord;
import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.ConsolidationSnapshot;
import com.recursa.core.model.HierarchyEntry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the decision prompt for one turn.
 * <p>
 * Pure and deterministic: the same inputs always produce the same prompt. When
 * the rendered history is over the entry or character cap, the oldest entries
 * are left out of the prompt; the history itself is never modified. Raw text
 * carried over by degraded consolidations is held to the same character cap.
 */
@Component
public class ContextBuilder {

    static final String NEXT_ACTION_REQUEST = "Actions inside <action_history> have already been executed; "
            + "do not repeat them. Output the next action(s).";

    private final int maxEntries;
    private final int maxChars;
    private final int maxResultChars;

    @Autowired
    public ContextBuilder(RuntimeProperties properties) {
        this(properties.getRenderedHistoryMaxEntries(), properties.getRenderedHistoryMaxChars(),
                properties.getActionResultMaxChars());
    }

    public ContextBuilder(int maxEntries, int maxChars, int maxResultChars) {
        this.maxEntries = maxEntries;
        this.maxChars = maxChars;
        this.maxResultChars = maxResultChars;
    }

    public Prompt build(AgentFrame frame, String staticInstructions, ConsolidationSnapshot latestSnapshot,
                        List<ActionRecord> renderedHistory, List<HierarchyEntry> hierarchyStatus) {
        List<String> included = capRendered(renderedHistory);
        int dropped = renderedHistory.size() - included.size();

        var sb = new StringBuilder();
        if (staticInstructions != null && !staticInstructions.isBlank()) {
            sb.append(staticInstructions.strip()).append("\n\n");
        }
        sb.append(PromptSections.identity(frame)).append("\n\n");
        sb.append(PromptSections.hierarchy(hierarchyStatus, frame.agentId())).append("\n\n");
        sb.append(PromptSections.snapshot(latestSnapshot, maxChars)).append("\n\n");
        if (dropped > 0) {
            sb.append("(").append(dropped).append(" older action(s) omitted to bound context size)\n");
        }
        sb.append(PromptSections.records(included)).append("\n\n");
        sb.append("<task_input>\n").append(frame.input() != null ? frame.input().strip() : "")
          .append("\n</task_input>");

        return new Prompt(sb.toString(), NEXT_ACTION_REQUEST, included.size(), dropped);
    }

    /**
     * Keeps the newest rendered entries that fit both caps, in original order.
     */
    private List<String> capRendered(List<ActionRecord> renderedHistory) {
        List<String> kept = new ArrayList<>();
        int chars = 0;
        for (int i = renderedHistory.size() - 1; i >= 0; i--) {
            String rendered = PromptSections.record(renderedHistory.get(i), maxResultChars);
            if (kept.size() >= maxEntries || chars + rendered.length() > maxChars) {
                break;
            }
            kept.add(0, rendered);
            chars += rendered.length();
        }
        return kept;
    }
}
