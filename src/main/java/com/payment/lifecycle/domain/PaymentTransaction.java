package com.payment.lifecycle.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only snapshot of a ledger row, handed to the gateway adapter, the
 * webhook path, the worker and the REST layer.
 */
@Value
@Builder
public class PaymentTransaction {

    Long id;
    String externalReference;
    Long payerId;
    Long contextId;
    /** Amount in minor currency units; always positive. */
    long amount;
    String currency;
    PaymentKind kind;
    String description;
    /** Gateway family that handled this transaction, fixed at creation. */
    String operator;
    TransactionStatus status;
    GatewayMetadata metadata;
    Instant createdAt;
    Instant updatedAt;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
