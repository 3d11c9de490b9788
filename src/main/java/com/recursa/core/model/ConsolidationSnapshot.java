package com.recursa.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Structured, compressed progress state that replaces a frame's rendered history
 * at each consolidation event.
 *
 * @param todoItems       task breakdown with per-item progress
 * @param durableFacts    information that must survive the history reset (files, rules, key findings)
 * @param nextStepPlan    concrete plan for the next consolidation window
 * @param carriedOver     raw unconsolidated history text carried by a degraded consolidation, empty otherwise
 * @param degraded        true when the snapshot was produced by the fallback path
 * @param throughSequence last fact-history sequence number covered by this snapshot
 * @param createdAt       when the snapshot was produced
 */
public record ConsolidationSnapshot(
    List<TodoItem> todoItems,
    String durableFacts,
    String nextStepPlan,
    String carriedOver,
    boolean degraded,
    long throughSequence,
    Instant createdAt
) implements Serializable {

    public ConsolidationSnapshot {
        todoItems = todoItems == null ? List.of() : List.copyOf(todoItems);
        durableFacts = durableFacts == null ? "" : durableFacts;
        nextStepPlan = nextStepPlan == null ? "" : nextStepPlan;
        carriedOver = carriedOver == null ? "" : carriedOver;
    }

    public static ConsolidationSnapshot empty() {
        return new ConsolidationSnapshot(List.of(), "", "", "", false, 0L, Instant.EPOCH);
    }

    /** One-line progress summary used in hierarchy views and failure details. */
    public String summary() {
        long done = todoItems.stream().filter(t -> t.status() == TodoStatus.DONE).count();
        String plan = nextStepPlan.isBlank() ? "-" : nextStepPlan.strip().lines().findFirst().orElse("-");
        return "todo " + done + "/" + todoItems.size() + " done" + (degraded ? " (degraded)" : "")
                + "; next: " + plan;
    }
}
