package com.recursa.core.model;

/**
 * Lifecycle status of an agent frame.
 */
public enum FrameStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
