package com.recursa.core.llm;

/**
 * Base class for failures of a model call. Thrown as-is for errors that are
 * neither transient, malformed output nor authorization failures.
 */
public class ModelInvocationException extends RuntimeException {

    public ModelInvocationException(String message) {
        super(message);
    }

    public ModelInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
