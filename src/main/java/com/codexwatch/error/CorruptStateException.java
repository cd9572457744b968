package com.codexwatch.error;

/**
 * The persisted checkpoint exists but cannot be understood. Never treated as
 * an empty checkpoint.
 */
public class CorruptStateException extends CodexwatchException {

    public CorruptStateException(String message) {
        super(message);
    }

    public CorruptStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
