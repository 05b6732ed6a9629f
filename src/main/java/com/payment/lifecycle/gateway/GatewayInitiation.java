package com.payment.lifecycle.gateway;

import com.payment.lifecycle.domain.GatewayMetadata;
import lombok.Builder;
import lombok.Value;

/**
 * Successful initiation: where to send the payer and the gateway's session token.
 */
@Value
@Builder
public class GatewayInitiation {

    String paymentUrl;
    String operatorToken;

    public GatewayMetadata toMetadata() {
        return GatewayMetadata.builder()
                .paymentUrl(paymentUrl)
                .operatorToken(operatorToken)
                .build();
    }
}
