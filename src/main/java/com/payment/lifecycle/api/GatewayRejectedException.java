package com.payment.lifecycle.api;

import lombok.Getter;

/**
 * The gateway refused the initiation outright. The transaction has been moved
 * to FAILED by the time this reaches the API caller.
 */
@Getter
public class GatewayRejectedException extends PaymentLifecycleException {

    /** Vendor response code, when the gateway returned one. */
    private final String gatewayCode;
    /** Set once the ledger row exists; null while the adapter is still talking to the gateway. */
    private final String externalReference;

    public GatewayRejectedException(String message, String gatewayCode) {
        this(message, gatewayCode, null);
    }

    public GatewayRejectedException(String message, String gatewayCode, String externalReference) {
        super(message);
        this.gatewayCode = gatewayCode;
        this.externalReference = externalReference;
    }

    public GatewayRejectedException withReference(String reference) {
        return new GatewayRejectedException(getMessage(), gatewayCode, reference);
    }

    @Override
    public String getErrorKind() {
        return "GATEWAY_REJECTED";
    }
}
