package com.payment.lifecycle.domain;

/**
 * Lifecycle states of a payment transaction. {@link #PENDING} is the only
 * non-terminal state; every other state is final for the ledger row.
 */
public enum TransactionStatus {
    /** Created locally, waiting for the gateway to confirm or deny. */
    PENDING,
    /** Gateway verification reported a successful payment. */
    ACCEPTED,
    /** Gateway verification reported an explicit refusal or cancellation. */
    REFUSED,
    /** Initiation rejected by the gateway, or reconciliation attempts exhausted. */
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
