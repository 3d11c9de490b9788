package com.recursa.core.llm;

/**
 * The model provider rejected the credentials. Fatal for the whole task.
 */
public class ModelAuthorizationException extends ModelInvocationException {

    public ModelAuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
