package com.recursa.core.hierarchy;

/**
 * Thrown when a spawn would push a frame deeper than the configured maximum depth.
 * The stack is left unchanged.
 */
public class DepthExceededException extends RuntimeException {

    private final int requestedLevel;
    private final int maxDepth;

    public DepthExceededException(int requestedLevel, int maxDepth) {
        super("Cannot spawn at level " + requestedLevel + ": maximum depth is " + maxDepth);
        this.requestedLevel = requestedLevel;
        this.maxDepth = maxDepth;
    }

    public int requestedLevel() {
        return requestedLevel;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
