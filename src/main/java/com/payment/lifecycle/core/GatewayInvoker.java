package com.payment.lifecycle.core;

import com.payment.lifecycle.api.GatewayUnavailableException;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.gateway.GatewayInitiation;
import com.payment.lifecycle.gateway.PaymentGatewayAdapter;
import com.payment.lifecycle.gateway.VerificationResult;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Calls the active gateway adapter through a circuit breaker named after the gateway.
 * An open circuit is reported as {@link GatewayUnavailableException} so callers treat it
 * like any other transient outage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayInvoker {

    private final PaymentGatewayAdapter adapter;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public GatewayInitiation initiate(PaymentTransaction transaction) {
        return call(() -> adapter.initiate(transaction), transaction.getExternalReference());
    }

    public VerificationResult verify(String externalReference) {
        return call(() -> adapter.verify(externalReference), externalReference);
    }

    public String getGatewayName() {
        return adapter.getGatewayName();
    }

    private <T> T call(Supplier<T> supplier, String externalReference) {
        String gatewayName = adapter.getGatewayName();
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(gatewayName);
        try {
            return CircuitBreaker.decorateSupplier(cb, supplier).get();
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open for gateway={}, reference={}", gatewayName, externalReference);
            throw new GatewayUnavailableException("Gateway " + gatewayName + " temporarily unavailable (circuit open)",
                    gatewayName, externalReference, e);
        }
    }
}
