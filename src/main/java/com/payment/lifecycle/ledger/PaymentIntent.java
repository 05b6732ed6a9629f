package com.payment.lifecycle.ledger;

import com.payment.lifecycle.domain.PaymentKind;
import lombok.Builder;
import lombok.Value;

/**
 * Everything needed to create a ledger row. All fields become immutable on the row.
 */
@Value
@Builder
public class PaymentIntent {

    Long payerId;
    /** Enrollment / session the payment funds. */
    Long contextId;
    /** Minor currency units. */
    long amount;
    String currency;
    PaymentKind kind;
    String description;
}
