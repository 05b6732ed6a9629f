package com.payment.lifecycle.api;

import com.payment.lifecycle.config.GatewayProperties;
import com.payment.lifecycle.webhook.WebhookIngestor;
import com.payment.lifecycle.webhook.WebhookResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway notification endpoint. Answers 200 for every authenticated notification about a
 * known transaction, including duplicates, so the gateway stops retrying.
 */
@RestController
@RequestMapping("/payments")
@RequiredArgsConstructor
@Tag(name = "Gateway notifications", description = "Asynchronous payment confirmations from the gateway")
public class PaymentNotificationController {

    private final WebhookIngestor webhookIngestor;
    private final GatewayProperties gatewayProperties;

    @PostMapping(value = "/notification", consumes = {MediaType.APPLICATION_FORM_URLENCODED_VALUE, MediaType.MULTIPART_FORM_DATA_VALUE})
    @Operation(summary = "Gateway notification (form)")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Accepted, including duplicate deliveries."),
            @ApiResponse(responseCode = "400", description = "AUTHENTICATION_FAILED or MALFORMED_NOTIFICATION."),
            @ApiResponse(responseCode = "404", description = "Unknown transaction reference.")
    })
    public Map<String, Object> notifyForm(@RequestParam Map<String, String> fields, HttpServletRequest request) {
        return handle(fields, request);
    }

    @PostMapping(value = "/notification", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Gateway notification (JSON)")
    public Map<String, Object> notifyJson(@RequestBody Map<String, Object> body, HttpServletRequest request) {
        Map<String, String> fields = new LinkedHashMap<>();
        body.forEach((name, value) -> fields.put(name, value != null ? String.valueOf(value) : null));
        return handle(fields, request);
    }

    private Map<String, Object> handle(Map<String, String> fields, HttpServletRequest request) {
        String signature = request.getHeader(gatewayProperties.getWebhook().getSignatureHeader());
        WebhookResult result = webhookIngestor.ingest(fields, signature, request.getRemoteAddr());
        return Map.of(
                "status", "success",
                "externalReference", result.getExternalReference(),
                "outcome", result.getOutcome().name(),
                "transactionStatus", result.getStatus().name());
    }
}
