package com.payment.lifecycle.gateway;

import com.payment.lifecycle.api.GatewayRejectedException;
import com.payment.lifecycle.domain.GatewayMetadata;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.TransactionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process gateway for local runs and integration tests. Amounts at or above
 * {@link #REJECT_AMOUNT_THRESHOLD} are rejected at initiation; verification reports
 * ACCEPTED unless another outcome was registered with {@link #simulate}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "payment.gateway.mode", havingValue = "mock")
public class MockGatewayAdapter implements PaymentGatewayAdapter {

    static final long REJECT_AMOUNT_THRESHOLD = 999_999L;

    private final Map<String, TransactionStatus> outcomes = new ConcurrentHashMap<>();

    @Override
    public String getGatewayName() {
        return "mock";
    }

    @Override
    public GatewayInitiation initiate(PaymentTransaction transaction) {
        log.info("Mock gateway initiate: reference={}, amount={} {}",
                transaction.getExternalReference(), transaction.getAmount(), transaction.getCurrency());
        if (transaction.getAmount() >= REJECT_AMOUNT_THRESHOLD) {
            throw new GatewayRejectedException("Simulated rejection for high amount", "MOCK_REJECTED",
                    transaction.getExternalReference());
        }
        return GatewayInitiation.builder()
                .paymentUrl("https://checkout.mock.local/pay/" + transaction.getExternalReference())
                .operatorToken("mock-" + UUID.randomUUID())
                .build();
    }

    @Override
    public VerificationResult verify(String externalReference) {
        TransactionStatus status = outcomes.getOrDefault(externalReference, TransactionStatus.ACCEPTED);
        log.info("Mock gateway verify: reference={}, status={}", externalReference, status);
        GatewayMetadata metadata = status == TransactionStatus.ACCEPTED
                ? GatewayMetadata.builder()
                    .paymentMethod("MOCK")
                    .operatorTransactionId("mock-op-" + externalReference)
                    .settledAt(Instant.now())
                    .build()
                : GatewayMetadata.EMPTY;
        return VerificationResult.builder()
                .externalReference(externalReference)
                .status(status)
                .vendorStatus(status.name())
                .metadata(metadata)
                .build();
    }

    /** Registers the status the next verifications of {@code externalReference} will report. */
    public void simulate(String externalReference, TransactionStatus status) {
        if (status == TransactionStatus.FAILED) {
            throw new IllegalArgumentException("A gateway never reports FAILED");
        }
        outcomes.put(externalReference, status);
    }
}
