package com.payment.lifecycle.gateway;

import com.payment.lifecycle.domain.GatewayMetadata;
import com.payment.lifecycle.domain.TransactionStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Normalized answer of a status check. {@code status} is ACCEPTED, REFUSED or PENDING;
 * {@code vendorStatus} keeps the raw gateway string for logs.
 */
@Value
@Builder
public class VerificationResult {

    String externalReference;
    TransactionStatus status;
    String vendorStatus;
    GatewayMetadata metadata;

    public boolean isPending() {
        return status == TransactionStatus.PENDING;
    }

    public static VerificationResult pending(String externalReference, String vendorStatus) {
        return VerificationResult.builder()
                .externalReference(externalReference)
                .status(TransactionStatus.PENDING)
                .vendorStatus(vendorStatus)
                .metadata(GatewayMetadata.EMPTY)
                .build();
    }
}
