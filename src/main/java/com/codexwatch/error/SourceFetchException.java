package com.codexwatch.error;

/**
 * GitHub could not be queried or answered with something unexpected.
 */
public class SourceFetchException extends CodexwatchException {

    public SourceFetchException(String message) {
        super(message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
