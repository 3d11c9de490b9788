package com.recursa.core.context;

import com.recursa.core.model.ActionRecord;
import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.ConsolidationSnapshot;
import com.recursa.core.model.HierarchyEntry;
import com.recursa.core.model.TodoItem;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the tagged sections shared by decision and consolidation prompts.
 * All methods are pure.
 */
public final class PromptSections {

    private PromptSections() {}

    public static String identity(AgentFrame frame) {
        return "<agent_identity>\n"
                + "name: " + frame.name() + "\n"
                + "agent_id: " + frame.agentId() + "\n"
                + "level: " + frame.level() + "\n"
                + "</agent_identity>";
    }

    public static String hierarchy(List<HierarchyEntry> entries, String currentAgentId) {
        var sb = new StringBuilder("<task_hierarchy>\n");
        for (HierarchyEntry entry : entries) {
            sb.append("  ".repeat(Math.max(0, entry.level())))
              .append("- ").append(entry.name())
              .append(" [").append(entry.status()).append("]");
            if (entry.agentId().equals(currentAgentId)) {
                sb.append(" <- you");
            }
            if (!entry.finalOutput().isBlank()) {
                sb.append(": ").append(firstLine(entry.finalOutput()));
            }
            sb.append("\n");
        }
        return sb.append("</task_hierarchy>").toString();
    }

    public static String snapshot(ConsolidationSnapshot snapshot) {
        return snapshot(snapshot, Integer.MAX_VALUE);
    }

    /**
     * Renders {@code snapshot}, keeping only the newest {@code maxCarriedChars} of its carried-over text.
     */
    public static String snapshot(ConsolidationSnapshot snapshot, int maxCarriedChars) {
        var sb = new StringBuilder("<progress_snapshot>\n");
        if (snapshot == null) {
            return sb.append("(none yet)\n</progress_snapshot>").toString();
        }
        sb.append("<todo_list>\n");
        int n = 1;
        for (TodoItem item : snapshot.todoItems()) {
            sb.append(n++).append(". ").append(item.text())
              .append(":[").append(item.status().name().toLowerCase()).append("]\n");
        }
        sb.append("</todo_list>\n");
        sb.append("<durable_facts>\n").append(snapshot.durableFacts().strip()).append("\n</durable_facts>\n");
        sb.append("<next_steps>\n").append(snapshot.nextStepPlan().strip()).append("\n</next_steps>\n");
        if (!snapshot.carriedOver().isBlank()) {
            sb.append("<carried_over>\n").append(newest(snapshot.carriedOver().strip(), maxCarriedChars))
              .append("\n</carried_over>\n");
        }
        return sb.append("</progress_snapshot>").toString();
    }

    /**
     * Last {@code maxChars} characters of {@code text}, cut at a line start when one is available.
     */
    public static String newest(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text == null ? "" : text;
        }
        String tail = text.substring(text.length() - Math.max(0, maxChars));
        int lineStart = tail.indexOf('\n');
        if (lineStart >= 0 && lineStart < tail.length() - 1) {
            tail = tail.substring(lineStart + 1);
        }
        int omitted = text.length() - tail.length();
        return "(" + omitted + " older chars omitted)\n" + tail;
    }

    public static String record(ActionRecord record, int maxResultChars) {
        return "<action seq=\"" + record.sequenceNo() + "\" name=\"" + record.actionName() + "\">\n"
                + "arguments: " + arguments(record.arguments()) + "\n"
                + (record.failed() ? "error: " : "result: ")
                + truncate(record.outcomeText(), maxResultChars) + "\n"
                + "</action>";
    }

    public static String records(List<String> renderedRecords) {
        if (renderedRecords.isEmpty()) {
            return "<action_history>\n</action_history>";
        }
        return "<action_history>\n" + String.join("\n", renderedRecords) + "\n</action_history>";
    }

    public static String arguments(Map<String, Object> arguments) {
        return arguments.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "... [truncated " + (text.length() - maxChars) + " chars]";
    }

    private static String firstLine(String text) {
        String line = text.strip().lines().findFirst().orElse("");
        return truncate(line, 120);
    }
}
