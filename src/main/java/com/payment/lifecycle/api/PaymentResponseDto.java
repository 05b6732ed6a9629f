package com.payment.lifecycle.api;

import com.payment.lifecycle.domain.GatewayMetadata;
import com.payment.lifecycle.domain.PaymentKind;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * REST view of a ledger row. The operator token stays server-side.
 */
@Value
@Builder
public class PaymentResponseDto {

    Long transactionId;
    String externalReference;
    Long payerId;
    Long contextId;
    long amount;
    String currency;
    PaymentKind kind;
    String description;
    String operator;
    TransactionStatus status;
    String paymentUrl;
    String paymentMethod;
    String operatorTransactionId;
    String errorMessage;
    Instant settledAt;
    Instant createdAt;
    Instant updatedAt;

    public static PaymentResponseDto from(PaymentTransaction tx) {
        if (tx == null) {
            throw new IllegalArgumentException("PaymentTransaction cannot be null");
        }
        GatewayMetadata metadata = tx.getMetadata() != null ? tx.getMetadata() : GatewayMetadata.EMPTY;
        return PaymentResponseDto.builder()
                .transactionId(tx.getId())
                .externalReference(tx.getExternalReference())
                .payerId(tx.getPayerId())
                .contextId(tx.getContextId())
                .amount(tx.getAmount())
                .currency(tx.getCurrency())
                .kind(tx.getKind())
                .description(tx.getDescription())
                .operator(tx.getOperator())
                .status(tx.getStatus())
                .paymentUrl(metadata.getPaymentUrl())
                .paymentMethod(metadata.getPaymentMethod())
                .operatorTransactionId(metadata.getOperatorTransactionId())
                .errorMessage(metadata.getErrorMessage())
                .settledAt(metadata.getSettledAt())
                .createdAt(tx.getCreatedAt())
                .updatedAt(tx.getUpdatedAt())
                .build();
    }
}
