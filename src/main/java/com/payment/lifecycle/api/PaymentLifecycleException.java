package com.payment.lifecycle.api;

/**
 * Base exception for payment lifecycle errors. Each subclass carries the error
 * kind returned to API callers by {@link GlobalExceptionHandler}.
 */
public abstract class PaymentLifecycleException extends RuntimeException {

    protected PaymentLifecycleException(String message) {
        super(message);
    }

    protected PaymentLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable machine-readable error kind, e.g. {@code INVALID_AMOUNT}. */
    public abstract String getErrorKind();
}
