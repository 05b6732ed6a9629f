package com.payment.lifecycle.api;

import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.TransactionStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InitiatePaymentResponseDto {

    Long transactionId;
    String externalReference;
    String paymentUrl;
    TransactionStatus status;

    public static InitiatePaymentResponseDto from(PaymentTransaction tx) {
        return InitiatePaymentResponseDto.builder()
                .transactionId(tx.getId())
                .externalReference(tx.getExternalReference())
                .paymentUrl(tx.getMetadata() != null ? tx.getMetadata().getPaymentUrl() : null)
                .status(tx.getStatus())
                .build();
    }
}
