package com.payment.lifecycle.api;

/**
 * Generated external reference collided with an existing ledger row.
 */
public class DuplicateReferenceException extends PaymentLifecycleException {

    public DuplicateReferenceException(String externalReference, Throwable cause) {
        super("External reference already exists: " + externalReference, cause);
    }

    @Override
    public String getErrorKind() {
        return "DUPLICATE_REFERENCE";
    }
}
