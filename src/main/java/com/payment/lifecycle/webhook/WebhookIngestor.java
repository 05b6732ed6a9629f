package com.payment.lifecycle.webhook;

import com.payment.lifecycle.api.AuthenticationFailedException;
import com.payment.lifecycle.api.GatewayUnavailableException;
import com.payment.lifecycle.api.MalformedNotificationException;
import com.payment.lifecycle.compliance.ComplianceAuditLogger;
import com.payment.lifecycle.config.GatewayProperties;
import com.payment.lifecycle.core.GatewayInvoker;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.StatusSource;
import com.payment.lifecycle.gateway.VerificationResult;
import com.payment.lifecycle.ledger.StatusChange;
import com.payment.lifecycle.ledger.TransactionLedger;
import com.payment.lifecycle.queue.ReconciliationQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

/**
 * Handles gateway notifications. A notification only says that something happened to a
 * reference; the status written to the ledger always comes from a server-to-server
 * verification, never from the notification body.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookIngestor {

    private final WebhookSignatureVerifier signatureVerifier;
    private final TransactionLedger ledger;
    private final GatewayInvoker gatewayInvoker;
    private final ReconciliationQueue queue;
    private final GatewayProperties gatewayProperties;
    private final ComplianceAuditLogger auditLogger;
    private final Clock clock;

    /**
     * @throws AuthenticationFailedException  bad or missing signature; nothing is read or written
     * @throws MalformedNotificationException no transaction reference in the payload
     * @throws com.payment.lifecycle.api.TransactionNotFoundException unknown reference
     */
    public WebhookResult ingest(Map<String, String> fields, String signature, String remoteAddress) {
        String reference = fields.get(gatewayProperties.getWebhook().getReferenceField());
        try {
            signatureVerifier.authenticate(fields, signature);
        } catch (AuthenticationFailedException e) {
            auditLogger.logAuthenticationFailure(reference, remoteAddress, e.getMessage());
            throw e;
        }

        if (reference == null || reference.isBlank()) {
            throw new MalformedNotificationException("Notification carries no "
                    + gatewayProperties.getWebhook().getReferenceField());
        }

        PaymentTransaction current = ledger.getByReference(reference);
        if (current.isTerminal()) {
            log.info("Notification for already resolved transaction: reference={}, status={}",
                    reference, current.getStatus());
            return result(reference, WebhookOutcome.DUPLICATE, current);
        }

        VerificationResult verification;
        try {
            verification = gatewayInvoker.verify(reference);
        } catch (GatewayUnavailableException e) {
            log.warn("Gateway unavailable while verifying notification, deferring to worker: reference={}", reference);
            expedite(reference);
            return result(reference, WebhookOutcome.DEFERRED, current);
        }

        if (verification.isPending()) {
            log.info("Notification received but gateway still pending: reference={}, vendorStatus={}",
                    reference, verification.getVendorStatus());
            return result(reference, WebhookOutcome.STILL_PENDING, current);
        }

        StatusChange change = ledger.applyStatusChange(reference, verification.getStatus(),
                verification.getMetadata(), StatusSource.WEBHOOK);
        PaymentTransaction after = change.getTransaction();
        WebhookOutcome outcome = change.isApplied() ? WebhookOutcome.APPLIED : WebhookOutcome.DUPLICATE;
        log.info("Notification processed: reference={}, outcome={}, status={}", reference, outcome, after.getStatus());
        return result(reference, outcome, after);
    }

    private void expedite(String reference) {
        try {
            queue.expedite(reference, clock.instant());
        } catch (DataAccessException e) {
            log.error("Could not expedite reconciliation for reference={}; the regular schedule still applies",
                    reference, e);
        }
    }

    private static WebhookResult result(String reference, WebhookOutcome outcome, PaymentTransaction tx) {
        return WebhookResult.builder()
                .externalReference(reference)
                .outcome(outcome)
                .status(tx.getStatus())
                .build();
    }
}
