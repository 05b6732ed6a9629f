package com.payment.lifecycle.ledger;

import com.payment.lifecycle.domain.PaymentTransaction;
import lombok.Value;

/**
 * Result of a status write: the stored transaction afterwards, and whether this call
 * performed the transition or found it already done by another writer.
 */
@Value
public class StatusChange {

    PaymentTransaction transaction;
    boolean applied;

    static StatusChange applied(PaymentTransaction transaction) {
        return new StatusChange(transaction, true);
    }

    static StatusChange unchanged(PaymentTransaction transaction) {
        return new StatusChange(transaction, false);
    }
}
