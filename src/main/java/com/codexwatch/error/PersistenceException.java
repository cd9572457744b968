package com.codexwatch.error;

/**
 * The checkpoint medium could not be read or written.
 */
public class PersistenceException extends CodexwatchException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
