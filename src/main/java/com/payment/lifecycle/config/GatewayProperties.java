package com.payment.lifecycle.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Merchant credentials and endpoints for the payment gateway. Bound once at
 * startup and injected into the adapter and the webhook authenticator; values
 * come from the environment, never from code.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "payment.gateway")
public class GatewayProperties {

    /** {@code cinetpay} for the real gateway, {@code mock} for local runs. */
    private String mode = "cinetpay";

    /** Operator tag stored on each transaction and used as reference prefix. */
    @NotBlank
    private String operator = "CINETPAY";

    @NotBlank
    private String baseUrl = "https://api-checkout.cinetpay.com";

    private String initiatePath = "/v2/payment";

    private String verifyPath = "/v2/payment/check";

    private String apiKey;

    private String siteId;

    /** Shared secret for webhook HMAC signatures. */
    private String secretKey;

    /** Where the gateway posts notifications. */
    private String notifyUrl;

    /** Where the payer is sent back after the hosted page. */
    private String returnUrl;

    private String channels = "ALL";

    private String lang = "fr";

    private List<String> supportedCurrencies = new ArrayList<>(List.of("XAF", "XOF", "EUR", "USD"));

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(15);

    private Webhook webhook = new Webhook();

    @Data
    public static class Webhook {

        /** Header carrying the HMAC of the notification fields. */
        private String signatureHeader = "x-token";

        /** Form/JSON field holding the transaction reference. */
        private String referenceField = "cpm_trans_id";
    }

    public boolean supportsCurrency(String currency) {
        return currency != null && supportedCurrencies.stream().anyMatch(c -> c.equalsIgnoreCase(currency));
    }
}
