package com.recursa.core.model;

/**
 * Progress marker of a todo item inside a consolidation snapshot.
 */
public enum TodoStatus {
    DONE,
    ONGOING,
    WAITING
}
