package com.payment.lifecycle.core;

import com.payment.lifecycle.api.GatewayRejectedException;
import com.payment.lifecycle.api.GatewayUnavailableException;
import com.payment.lifecycle.compliance.ComplianceAuditLogger;
import com.payment.lifecycle.config.ReconciliationProperties;
import com.payment.lifecycle.domain.GatewayMetadata;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.StatusSource;
import com.payment.lifecycle.domain.TransactionStatus;
import com.payment.lifecycle.gateway.GatewayInitiation;
import com.payment.lifecycle.ledger.PaymentIntent;
import com.payment.lifecycle.ledger.TransactionLedger;
import com.payment.lifecycle.queue.ReconciliationQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Create, initiate, enqueue. The gateway call runs outside any database transaction:
 * the PENDING row is committed first so a crash mid-call still leaves a ledger row that
 * the queue rebuild can pick up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentInitiationService {

    private final TransactionLedger ledger;
    private final GatewayInvoker gatewayInvoker;
    private final ReconciliationQueue queue;
    private final ReconciliationProperties reconciliationProperties;
    private final ComplianceAuditLogger auditLogger;
    private final Clock clock;

    /**
     * @return the PENDING transaction carrying the payment URL
     * @throws GatewayRejectedException    the gateway refused; the transaction is FAILED
     * @throws GatewayUnavailableException the gateway could not be reached; the transaction
     *                                     stays PENDING and is queued for reconciliation
     */
    public PaymentTransaction initiate(PaymentIntent intent) {
        PaymentTransaction created = ledger.create(intent);
        String reference = created.getExternalReference();

        GatewayInitiation initiation;
        try {
            initiation = gatewayInvoker.initiate(created);
        } catch (GatewayRejectedException e) {
            auditLogger.logGatewayRejected(reference, e.getGatewayCode(), e.getMessage());
            ledger.applyStatus(reference, TransactionStatus.FAILED, GatewayMetadata.error(e.getMessage()),
                    StatusSource.INITIATION);
            throw e.getExternalReference() != null ? e : e.withReference(reference);
        } catch (GatewayUnavailableException e) {
            log.warn("Gateway unavailable during initiation, queued for reconciliation: reference={}", reference);
            scheduleFirstCheck(reference);
            throw e;
        }

        PaymentTransaction initiated = ledger.attachMetadata(reference, initiation.toMetadata());
        scheduleFirstCheck(reference);
        log.info("Payment initiated: reference={}, gateway={}", reference, gatewayInvoker.getGatewayName());
        return initiated;
    }

    private void scheduleFirstCheck(String reference) {
        try {
            queue.enqueue(reference, clock.instant().plus(reconciliationProperties.getFirstCheckDelay()));
        } catch (DataAccessException e) {
            log.error("Could not queue reference={} for reconciliation; it will be restored by the next queue rebuild",
                    reference, e);
        }
    }
}
