package com.codexwatch.error;

public class SummarizeException extends CodexwatchException {

    public SummarizeException(String message) {
        super(message);
    }

    public SummarizeException(String message, Throwable cause) {
        super(message, cause);
    }
}
