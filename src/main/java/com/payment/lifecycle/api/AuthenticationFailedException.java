package com.payment.lifecycle.api;

/**
 * Webhook signature did not match. The message stays in server logs; callers
 * only see the HTTP status.
 */
public class AuthenticationFailedException extends PaymentLifecycleException {

    public AuthenticationFailedException(String message) {
        super(message);
    }

    @Override
    public String getErrorKind() {
        return "AUTHENTICATION_FAILED";
    }
}
