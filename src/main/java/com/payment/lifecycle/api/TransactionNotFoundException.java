package com.payment.lifecycle.api;

/**
 * No ledger row for the given id or external reference.
 */
public class TransactionNotFoundException extends PaymentLifecycleException {

    public TransactionNotFoundException(String message) {
        super(message);
    }

    public static TransactionNotFoundException byId(Long id) {
        return new TransactionNotFoundException("Transaction not found: id=" + id);
    }

    public static TransactionNotFoundException byReference(String externalReference) {
        return new TransactionNotFoundException("Transaction not found: reference=" + externalReference);
    }

    @Override
    public String getErrorKind() {
        return "NOT_FOUND";
    }
}
