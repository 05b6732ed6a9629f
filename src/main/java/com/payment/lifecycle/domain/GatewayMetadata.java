package com.payment.lifecycle.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Opaque gateway-supplied fields attached to a transaction. Written additively:
 * a field that already has a value on the ledger row is never overwritten or cleared.
 */
@Value
@Builder
public class GatewayMetadata {

    public static final GatewayMetadata EMPTY = GatewayMetadata.builder().build();

    /** Hosted payment page returned by initiation. */
    String paymentUrl;
    /** Gateway token for the payment page session. */
    String operatorToken;
    /** Gateway-side transaction id (mobile money operator id, card auth id...). */
    String operatorTransactionId;
    /** Channel the payer actually used (e.g. OM, MOMO, VISAM). */
    String paymentMethod;
    /** Gateway error or refusal message. */
    String errorMessage;
    /** Settlement timestamp reported by the gateway. */
    Instant settledAt;

    public static GatewayMetadata error(String message) {
        return GatewayMetadata.builder().errorMessage(message).build();
    }

    public boolean isEmpty() {
        return paymentUrl == null && operatorToken == null && operatorTransactionId == null
                && paymentMethod == null && errorMessage == null && settledAt == null;
    }
}
