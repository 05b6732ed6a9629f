package com.payment.lifecycle.api;

import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.TransactionStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Summary shown to a payer coming back from the hosted payment page.
 */
@Value
@Builder
public class PaymentReturnResponseDto {

    String externalReference;
    TransactionStatus status;
    long amount;
    String currency;
    String description;

    public static PaymentReturnResponseDto from(PaymentTransaction tx) {
        return PaymentReturnResponseDto.builder()
                .externalReference(tx.getExternalReference())
                .status(tx.getStatus())
                .amount(tx.getAmount())
                .currency(tx.getCurrency())
                .description(tx.getDescription())
                .build();
    }
}
