package com.payment.lifecycle.api;

import lombok.Getter;

/**
 * Transient network, timeout or server-side failure talking to the gateway.
 * Never moves a transaction's status; callers retry later.
 */
@Getter
public class GatewayUnavailableException extends PaymentLifecycleException {

    private final String gatewayName;
    private final String externalReference;

    public GatewayUnavailableException(String message, String gatewayName, String externalReference) {
        super(message);
        this.gatewayName = gatewayName;
        this.externalReference = externalReference;
    }

    public GatewayUnavailableException(String message, String gatewayName, String externalReference, Throwable cause) {
        super(message, cause);
        this.gatewayName = gatewayName;
        this.externalReference = externalReference;
    }

    @Override
    public String getErrorKind() {
        return "GATEWAY_UNAVAILABLE";
    }
}
