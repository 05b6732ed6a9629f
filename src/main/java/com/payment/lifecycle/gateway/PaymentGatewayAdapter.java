package com.payment.lifecycle.gateway;

import com.payment.lifecycle.api.GatewayRejectedException;
import com.payment.lifecycle.api.GatewayUnavailableException;
import com.payment.lifecycle.domain.PaymentTransaction;

/**
 * Wire protocol of one payment gateway family. Adapters translate ledger snapshots into
 * gateway requests and normalize responses; they never touch the ledger themselves.
 * Calls are wrapped with a circuit breaker by {@link com.payment.lifecycle.core.GatewayInvoker}.
 */
public interface PaymentGatewayAdapter {

    /**
     * Name used for logging and as the circuit breaker instance.
     */
    String getGatewayName();

    /**
     * Open a hosted payment session for the transaction.
     *
     * @throws GatewayRejectedException    the gateway answered with a non-success code
     * @throws GatewayUnavailableException network error, timeout or 5xx
     */
    GatewayInitiation initiate(PaymentTransaction transaction);

    /**
     * Server-to-server status check. Never returns FAILED: statuses the adapter does not
     * recognize come back as PENDING.
     *
     * @throws GatewayUnavailableException network error, timeout or 5xx
     */
    VerificationResult verify(String externalReference);
}
