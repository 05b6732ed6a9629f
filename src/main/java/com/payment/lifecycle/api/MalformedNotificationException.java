package com.payment.lifecycle.api;

/**
 * Authenticated notification that lacks the fields needed to act on it.
 */
public class MalformedNotificationException extends PaymentLifecycleException {

    public MalformedNotificationException(String message) {
        super(message);
    }

    @Override
    public String getErrorKind() {
        return "MALFORMED_NOTIFICATION";
    }
}
