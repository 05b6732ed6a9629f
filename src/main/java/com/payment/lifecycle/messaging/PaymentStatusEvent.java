package com.payment.lifecycle.messaging;

import com.payment.lifecycle.domain.PaymentKind;
import com.payment.lifecycle.domain.StatusSource;
import com.payment.lifecycle.domain.TransactionStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Status-changed notification for the enrollment side: emitted once per transaction,
 * when it reaches ACCEPTED, REFUSED or FAILED. Keyed by external reference.
 */
@Value
@Builder
@Jacksonized
public class PaymentStatusEvent {

    String eventId;
    Long transactionId;
    String externalReference;
    Long payerId;
    Long contextId;
    PaymentKind kind;
    TransactionStatus status;
    long amount;
    String currency;
    String operator;
    StatusSource source;
    Instant timestamp;
}
