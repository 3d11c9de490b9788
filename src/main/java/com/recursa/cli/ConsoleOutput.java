package com.recursa.cli;

import com.recursa.core.events.RecursaEvent;
import com.recursa.core.model.FrameStatus;
import com.recursa.core.model.HierarchyEntry;
import com.recursa.core.model.TaskOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) RECURSA v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [RECURSA]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    public static void event(RecursaEvent event) {
        String prefix = switch (event.eventType()) {
            case "task.started" -> "@|fg(cyan) [TASK]|@";
            case "frame.pushed", "frame.popped" -> "@|fg(blue) [FRAME]|@";
            case "consolidation.completed" -> "@|fg(magenta) [CONSOLIDATE]|@";
            case "consolidation.degraded" -> "@|fg(yellow) [CONSOLIDATE]|@";
            case "capability.violation" -> "@|fg(red) [DENIED]|@";
            case "task.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "task.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String agent = event.agentId() != null ? event.agentId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + agent + event.payload()));
    }

    /**
     * Event-type prefix for a family name given on the command line; null prints every event.
     */
    static String eventFamily(String family) {
        if (family == null || family.isBlank()) {
            return null;
        }
        String f = family.strip();
        return f.endsWith(".") ? f : f + ".";
    }

    public static void outcome(TaskOutcome outcome) {
        System.out.println();
        if (outcome.completed()) {
            success("Task " + outcome.taskId() + " completed.");
            System.out.println(outcome.payload());
        } else {
            error("Task " + outcome.taskId() + " failed [" + outcome.reason() + "]: " + outcome.detail());
            if (!outcome.partialFactHistory().isEmpty()) {
                info("Root agent recorded " + outcome.partialFactHistory().size() + " action(s) before failing.");
            }
        }
    }

    public static void hierarchyEntry(HierarchyEntry entry) {
        String color = entry.status() == FrameStatus.COMPLETED ? "fg(green)"
                : entry.status() == FrameStatus.FAILED ? "fg(red)" : "fg(cyan)";
        String indent = "  ".repeat(entry.level() + 1);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(indent + "@|" + color + " " + entry.status() + "|@ "
                + entry.agentId()));
        if (!entry.progressSummary().isBlank()) {
            System.out.println(indent + "    progress: " + entry.progressSummary());
        }
        if (!entry.finalOutput().isBlank()) {
            System.out.println(indent + "    output: " + truncate(entry.finalOutput(), 100));
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String single = s.replace('\n', ' ');
        return single.length() <= max ? single : single.substring(0, max - 3) + "...";
    }
}
