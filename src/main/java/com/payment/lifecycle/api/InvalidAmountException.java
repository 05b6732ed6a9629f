package com.payment.lifecycle.api;

/**
 * Amount was zero or negative at creation. Nothing is persisted.
 */
public class InvalidAmountException extends PaymentLifecycleException {

    public InvalidAmountException(long amount) {
        super("Amount must be positive (minor units), got " + amount);
    }

    @Override
    public String getErrorKind() {
        return "INVALID_AMOUNT";
    }
}
