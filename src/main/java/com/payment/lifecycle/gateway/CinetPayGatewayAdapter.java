package com.payment.lifecycle.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.lifecycle.api.GatewayRejectedException;
import com.payment.lifecycle.api.GatewayUnavailableException;
import com.payment.lifecycle.config.GatewayProperties;
import com.payment.lifecycle.domain.GatewayMetadata;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.TransactionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CinetPay checkout API. Initiation opens a hosted payment page; verification is the
 * authoritative server-to-server status check used by both the webhook path and the worker.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "payment.gateway.mode", havingValue = "cinetpay", matchIfMissing = true)
public class CinetPayGatewayAdapter implements PaymentGatewayAdapter {

    static final String GATEWAY_NAME = "cinetpay";
    static final String INITIATE_SUCCESS_CODE = "201";
    static final String VERIFY_SUCCESS_CODE = "00";

    private static final DateTimeFormatter PAYMENT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RestTemplate restTemplate;
    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    public CinetPayGatewayAdapter(@Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                                  GatewayProperties properties,
                                  ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getGatewayName() {
        return GATEWAY_NAME;
    }

    @Override
    public GatewayInitiation initiate(PaymentTransaction transaction) {
        String reference = transaction.getExternalReference();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("apikey", properties.getApiKey());
        body.put("site_id", properties.getSiteId());
        body.put("transaction_id", reference);
        body.put("amount", transaction.getAmount());
        body.put("currency", transaction.getCurrency());
        body.put("description", transaction.getDescription());
        body.put("notify_url", properties.getNotifyUrl());
        body.put("return_url", properties.getReturnUrl());
        body.put("channels", properties.getChannels());
        body.put("lang", properties.getLang());
        body.put("customer_id", String.valueOf(transaction.getPayerId()));

        log.info("CinetPay initiate: reference={}, amount={}, currency={}",
                reference, transaction.getAmount(), transaction.getCurrency());
        JsonNode response;
        try {
            response = restTemplate.postForObject(url(properties.getInitiatePath()), body, JsonNode.class);
        } catch (HttpClientErrorException e) {
            JsonNode errorBody = readBody(e.getResponseBodyAsString());
            String message = errorBody != null ? errorBody.path("message").asText(e.getStatusText()) : e.getStatusText();
            String code = errorBody != null ? errorBody.path("code").asText(null) : String.valueOf(e.getStatusCode().value());
            log.warn("CinetPay initiate rejected: reference={}, httpStatus={}, code={}", reference, e.getStatusCode(), code);
            throw new GatewayRejectedException(message, code, reference);
        } catch (RestClientException e) {
            throw unavailable("initiate", reference, e);
        }

        if (response == null) {
            throw new GatewayUnavailableException("Empty initiate response from CinetPay", GATEWAY_NAME, reference);
        }
        String code = response.path("code").asText(null);
        if (!INITIATE_SUCCESS_CODE.equals(code)) {
            String message = response.path("message").asText("Unknown gateway error");
            String description = response.path("description").asText(null);
            log.warn("CinetPay initiate refused: reference={}, code={}, message={}", reference, code, message);
            throw new GatewayRejectedException(description != null ? message + ": " + description : message, code, reference);
        }

        JsonNode data = response.path("data");
        GatewayInitiation initiation = GatewayInitiation.builder()
                .paymentUrl(data.path("payment_url").asText(null))
                .operatorToken(data.path("payment_token").asText(null))
                .build();
        log.info("CinetPay initiate accepted: reference={}, hasPaymentUrl={}", reference, initiation.getPaymentUrl() != null);
        return initiation;
    }

    @Override
    public VerificationResult verify(String externalReference) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("apikey", properties.getApiKey());
        body.put("site_id", properties.getSiteId());
        body.put("transaction_id", externalReference);

        JsonNode response;
        try {
            response = restTemplate.postForObject(url(properties.getVerifyPath()), body, JsonNode.class);
        } catch (HttpClientErrorException e) {
            // CinetPay answers some non-final states with a 4xx and a regular JSON body.
            response = readBody(e.getResponseBodyAsString());
            if (response == null) {
                log.warn("CinetPay verify returned {} without a readable body: reference={}",
                        e.getStatusCode(), externalReference);
                return VerificationResult.pending(externalReference, "HTTP_" + e.getStatusCode().value());
            }
        } catch (RestClientException e) {
            throw unavailable("verify", externalReference, e);
        }

        if (response == null) {
            throw new GatewayUnavailableException("Empty verify response from CinetPay", GATEWAY_NAME, externalReference);
        }
        return toVerificationResult(externalReference, response);
    }

    VerificationResult toVerificationResult(String externalReference, JsonNode response) {
        String code = response.path("code").asText(null);
        String message = response.path("message").asText(null);
        JsonNode data = response.path("data");
        String vendorStatus = data.path("status").asText(null);
        if (vendorStatus == null && !VERIFY_SUCCESS_CODE.equals(code)) {
            // Non-final checks carry the state name in "message", e.g. WAITING_CUSTOMER_PAYMENT.
            vendorStatus = message;
        }

        CinetPayStatus cinetPayStatus = CinetPayStatus.fromVendor(vendorStatus);
        if (cinetPayStatus == CinetPayStatus.UNKNOWN) {
            log.warn("Unrecognized CinetPay status, keeping transaction pending: reference={}, code={}, vendorStatus={}",
                    externalReference, code, vendorStatus);
        }
        TransactionStatus status = cinetPayStatus.toTransactionStatus();

        GatewayMetadata.GatewayMetadataBuilder metadata = GatewayMetadata.builder();
        if (status == TransactionStatus.ACCEPTED) {
            metadata.paymentMethod(data.path("payment_method").asText(null))
                    .operatorTransactionId(data.path("operator_id").asText(null))
                    .settledAt(parsePaymentDate(data.path("payment_date").asText(null)));
        } else if (status == TransactionStatus.REFUSED) {
            metadata.paymentMethod(data.path("payment_method").asText(null))
                    .errorMessage(message != null ? message : "Payment refused");
        }

        log.info("CinetPay verify: reference={}, code={}, vendorStatus={}, status={}",
                externalReference, code, vendorStatus, status);
        return VerificationResult.builder()
                .externalReference(externalReference)
                .status(status)
                .vendorStatus(vendorStatus)
                .metadata(metadata.build())
                .build();
    }

    /** 5xx, timeouts and I/O errors all end up here. */
    private GatewayUnavailableException unavailable(String operation, String reference, RestClientException e) {
        log.warn("CinetPay {} unavailable: reference={}, cause={}", operation, reference, e.getMessage());
        return new GatewayUnavailableException("CinetPay " + operation + " failed: " + e.getMessage(),
                GATEWAY_NAME, reference, e);
    }

    private JsonNode readBody(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (Exception e) {
            log.debug("Gateway error body is not JSON: {}", e.getMessage());
            return null;
        }
    }

    private static Instant parsePaymentDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(raw, PAYMENT_DATE).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable CinetPay payment_date={}", raw);
            return null;
        }
    }

    private String url(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
