package com.agentcollab.core.state;

/**
 * Raised when persisted task state cannot be read or committed.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
