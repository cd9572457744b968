package com.codexwatch.error;

/**
 * The notification was not accepted by the destination.
 */
public class DeliveryException extends CodexwatchException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
