package com.specforge.orchestrator.store;

/**
 * Thrown when the session store cannot read or write session state.
 */
public class SessionStoreException extends RuntimeException {

    public SessionStoreException(String message) {
        super(message);
    }

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
