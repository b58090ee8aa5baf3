package com.rxgate.fulfillmentservice.notification;

/**
 * Delivery of a decision notification failed. Never escapes a decision; it is
 * recorded as a {@link NotificationFailure} instead.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
