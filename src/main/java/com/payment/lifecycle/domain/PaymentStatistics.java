package com.payment.lifecycle.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Aggregate counts over the ledger.
 */
@Value
@Builder
public class PaymentStatistics {

    long total;
    long pending;
    long accepted;
    long refused;
    long failed;
    /** Accepted amounts in minor units, per ISO 4217 currency. */
    Map<String, Long> acceptedAmountByCurrency;
}
