package com.recursa.core.model;

/**
 * Typed failure reasons surfaced on action records, frame results and task outcomes.
 */
public enum FailureReason {
    TOOL_ERROR,
    TRANSIENT_MODEL_ERROR,
    MALFORMED_MODEL_OUTPUT,
    MODEL_AUTHORIZATION,
    CAPABILITY_VIOLATION,
    CONSOLIDATION_DEGRADED,
    TURN_BUDGET_EXCEEDED,
    DEPTH_EXCEEDED,
    STATE_STORE_IO_ERROR,
    CHILD_FAILED,
    CANCELLED,
    UNKNOWN_TASK,
    TASK_ALREADY_RUNNING
}
