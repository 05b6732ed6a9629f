package com.payment.lifecycle.ledger;

import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.StatusSource;
import com.payment.lifecycle.domain.TransactionStatus;
import lombok.Value;

/**
 * Published inside the ledger transaction when a row enters a terminal status.
 * Listeners act on it only after the commit.
 */
@Value
public class TransactionResolvedEvent {

    PaymentTransaction transaction;
    TransactionStatus previousStatus;
    StatusSource source;
}
