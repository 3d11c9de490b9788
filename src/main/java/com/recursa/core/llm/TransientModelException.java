package com.recursa.core.llm;

/**
 * A model call failed in a way that may succeed if retried (timeout, rate limit, 5xx).
 */
public class TransientModelException extends ModelInvocationException {

    public TransientModelException(String message) {
        super(message);
    }

    public TransientModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
