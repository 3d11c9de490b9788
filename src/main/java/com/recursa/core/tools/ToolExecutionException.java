package com.recursa.core.tools;

/**
 * A tool call failed. The message is recorded as the action's error and shown
 * to the agent on its next turn.
 */
public class ToolExecutionException extends RuntimeException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
