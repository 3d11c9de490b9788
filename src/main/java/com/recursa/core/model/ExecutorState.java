package com.recursa.core.model;

/**
 * States of the per-frame turn loop.
 */
public enum ExecutorState {
    AWAITING_DECISION,
    EXECUTING_ACTIONS,
    CONSOLIDATING,
    COMPLETED,
    FAILED
}
