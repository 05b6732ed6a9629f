package com.payment.lifecycle.persistence.entity;

import com.payment.lifecycle.domain.GatewayMetadata;
import com.payment.lifecycle.domain.PaymentKind;
import com.payment.lifecycle.domain.TransactionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Ledger row: one per payment attempt, keyed by the external reference shared with the gateway.
 * Status is the only business field that changes after creation, through the conditional
 * update in {@link com.payment.lifecycle.persistence.repository.PaymentTransactionRepository}.
 */
@Entity
@Table(name = "payment_transactions", indexes = {
    @Index(name = "idx_payment_external_reference", columnList = "external_reference", unique = true),
    @Index(name = "idx_payment_payer_id", columnList = "payer_id"),
    @Index(name = "idx_payment_status", columnList = "status"),
    @Index(name = "idx_payment_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "external_reference", nullable = false, unique = true, updatable = false, length = 120)
    private String externalReference;

    @Column(name = "payer_id", nullable = false, updatable = false)
    private Long payerId;

    @Column(name = "context_id", nullable = false, updatable = false)
    private Long contextId;

    @Column(name = "amount", nullable = false, updatable = false)
    private Long amount;

    @Column(name = "currency", nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false, length = 32)
    private PaymentKind kind;

    @Column(name = "description")
    private String description;

    @Column(name = "operator", nullable = false, updatable = false, length = 32)
    private String operator;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TransactionStatus status;

    @Column(name = "payment_url", length = 1000)
    private String paymentUrl;

    @Column(name = "operator_token", length = 500)
    private String operatorToken;

    @Column(name = "operator_transaction_id")
    private String operatorTransactionId;

    @Column(name = "payment_method", length = 64)
    private String paymentMethod;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "settled_at")
    private Instant settledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Copies every metadata field that is still empty on this row. Fields already set are kept.
     *
     * @return true if at least one column changed
     */
    public boolean mergeMetadata(GatewayMetadata metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return false;
        }
        boolean changed = false;
        if (paymentUrl == null && metadata.getPaymentUrl() != null) {
            paymentUrl = metadata.getPaymentUrl();
            changed = true;
        }
        if (operatorToken == null && metadata.getOperatorToken() != null) {
            operatorToken = metadata.getOperatorToken();
            changed = true;
        }
        if (operatorTransactionId == null && metadata.getOperatorTransactionId() != null) {
            operatorTransactionId = metadata.getOperatorTransactionId();
            changed = true;
        }
        if (paymentMethod == null && metadata.getPaymentMethod() != null) {
            paymentMethod = metadata.getPaymentMethod();
            changed = true;
        }
        if (errorMessage == null && metadata.getErrorMessage() != null) {
            errorMessage = truncate(metadata.getErrorMessage(), 1000);
            changed = true;
        }
        if (settledAt == null && metadata.getSettledAt() != null) {
            settledAt = metadata.getSettledAt();
            changed = true;
        }
        return changed;
    }

    public GatewayMetadata toMetadata() {
        return GatewayMetadata.builder()
                .paymentUrl(paymentUrl)
                .operatorToken(operatorToken)
                .operatorTransactionId(operatorTransactionId)
                .paymentMethod(paymentMethod)
                .errorMessage(errorMessage)
                .settledAt(settledAt)
                .build();
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
