package com.recursa.core.llm;

/**
 * The model answered, but the answer could not be parsed into the expected shape.
 */
public class MalformedModelOutputException extends ModelInvocationException {

    public MalformedModelOutputException(String message) {
        super(message);
    }

    public MalformedModelOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
