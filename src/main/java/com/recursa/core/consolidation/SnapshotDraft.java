package com.recursa.core.consolidation;

import java.util.List;

/**
 * Structured answer of the consolidation model call.
 *
 * @param todoList         task breakdown; status is one of done, ongoing, waiting
 * @param fileDescriptions workspace files worth remembering and what they hold
 * @param durableFacts     rules, findings and content the next steps depend on
 * @param nextSteps        concrete, tool-level plan for the next window
 */
public record SnapshotDraft(
    List<TodoDraft> todoList,
    String fileDescriptions,
    String durableFacts,
    String nextSteps
) {

    /**
     * @param text   the work item
     * @param status done, ongoing or waiting
     * @param notes  optional progress notes for ongoing items
     */
    public record TodoDraft(String text, String status, String notes) {}
}
