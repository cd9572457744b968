package com.codexwatch.error;

/**
 * Base of every failure the job raises on purpose.
 */
public class CodexwatchException extends RuntimeException {

    public CodexwatchException(String message) {
        super(message);
    }

    public CodexwatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
