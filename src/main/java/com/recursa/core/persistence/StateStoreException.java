package com.recursa.core.persistence;

/**
 * Thrown when task state cannot be written or read. Fatal to the running task;
 * the last successfully persisted state stays intact.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
