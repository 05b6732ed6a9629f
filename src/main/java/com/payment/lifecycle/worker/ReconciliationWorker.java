package com.payment.lifecycle.worker;

import com.payment.lifecycle.api.GatewayUnavailableException;
import com.payment.lifecycle.compliance.ComplianceAuditLogger;
import com.payment.lifecycle.config.GatewayProperties;
import com.payment.lifecycle.config.ReconciliationProperties;
import com.payment.lifecycle.core.GatewayInvoker;
import com.payment.lifecycle.domain.GatewayMetadata;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.StatusSource;
import com.payment.lifecycle.domain.TransactionStatus;
import com.payment.lifecycle.gateway.VerificationResult;
import com.payment.lifecycle.ledger.TransactionLedger;
import com.payment.lifecycle.queue.QueueEntry;
import com.payment.lifecycle.queue.ReconciliationQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Polls the gateway for transactions whose notification has not arrived. Each tick works
 * only from what the queue reports as due at {@code now}; all state between ticks lives in
 * the queue entries, so a restarted process picks up exactly where the last one stopped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationWorker {

    static final int MAX_BACKOFF_SHIFT = 16;

    private final ReconciliationQueue queue;
    private final TransactionLedger ledger;
    private final GatewayInvoker gatewayInvoker;
    private final ReconciliationProperties properties;
    private final ComplianceAuditLogger auditLogger;
    private final GatewayProperties gatewayProperties;

    public ReconciliationTickResult tick(Instant now) {
        List<QueueEntry> due = queue.dueEntries(now, claimLimit());
        if (due.isEmpty()) {
            return ReconciliationTickResult.EMPTY;
        }
        Counters counters = new Counters();
        counters.claimed = due.size();
        for (QueueEntry entry : due) {
            try {
                process(entry, now, counters);
            } catch (RuntimeException e) {
                counters.errors++;
                log.error("Reconciliation of reference={} failed; retried after lease expiry",
                        entry.getExternalReference(), e);
            }
        }
        return counters.toResult();
    }

    /**
     * Verifies one reference immediately without consuming a queue attempt.
     *
     * @throws GatewayUnavailableException gateway unreachable; nothing changes
     */
    public PaymentTransaction verifyNow(String externalReference) {
        PaymentTransaction current = ledger.getByReference(externalReference);
        if (current.isTerminal()) {
            return current;
        }
        VerificationResult result = gatewayInvoker.verify(externalReference);
        if (result.isPending()) {
            log.info("Manual verification still pending: reference={}, vendorStatus={}",
                    externalReference, result.getVendorStatus());
            return current;
        }
        PaymentTransaction after = ledger.applyStatus(externalReference, result.getStatus(),
                result.getMetadata(), StatusSource.MANUAL);
        if (after.isTerminal()) {
            queue.remove(externalReference);
        }
        return after;
    }

    private void process(QueueEntry entry, Instant now, Counters counters) {
        String reference = entry.getExternalReference();
        Optional<PaymentTransaction> tx = ledger.findByReference(reference);
        if (tx.isEmpty()) {
            log.warn("Queued reference has no ledger row, dropping: reference={}", reference);
            queue.remove(reference);
            counters.dropped++;
            return;
        }
        if (tx.get().isTerminal()) {
            log.debug("Queued reference already resolved, dropping: reference={}, status={}",
                    reference, tx.get().getStatus());
            queue.remove(reference);
            counters.dropped++;
            return;
        }

        VerificationResult result;
        try {
            result = gatewayInvoker.verify(reference);
        } catch (GatewayUnavailableException e) {
            int streak = entry.getUnavailableStreak() + 1;
            Duration delay = backoff(streak);
            log.warn("Gateway unavailable during reconciliation: reference={}, attempts={}/{}, unavailableStreak={}, retryIn={}",
                    reference, entry.getAttempts(), maxAttempts(entry), streak, delay);
            queue.reschedule(reference, entry.getAttempts(), streak, now.plus(delay));
            counters.rescheduled++;
            return;
        }

        int attempts = entry.getAttempts() + 1;
        if (!result.isPending()) {
            PaymentTransaction after = ledger.applyStatus(reference, result.getStatus(),
                    result.getMetadata(), StatusSource.WORKER);
            queue.remove(reference);
            counters.resolved++;
            log.info("Reconciled: reference={}, status={}, attempt={}", reference, after.getStatus(), attempts);
            return;
        }
        log.debug("Still pending: reference={}, attempt={}/{}, vendorStatus={}",
                reference, attempts, maxAttempts(entry), result.getVendorStatus());

        if (attempts >= maxAttempts(entry)) {
            ledger.applyStatus(reference, TransactionStatus.FAILED,
                    GatewayMetadata.error("Reconciliation attempts exhausted after " + attempts + " checks"),
                    StatusSource.WORKER);
            auditLogger.logAttemptsExhausted(reference, attempts);
            queue.remove(reference);
            counters.exhausted++;
            return;
        }
        queue.reschedule(reference, attempts, now.plus(properties.getCheckInterval()));
        counters.rescheduled++;
    }

    /**
     * Entries claimed per tick. Verifications run one after another and each may take up to
     * the connect plus read timeout, so the batch is cut to what fits inside one lease.
     */
    int claimLimit() {
        long perCallMillis = gatewayProperties.getConnectTimeout().plus(gatewayProperties.getReadTimeout()).toMillis();
        if (perCallMillis <= 0) {
            return properties.getBatchSize();
        }
        long fitting = properties.getLease().toMillis() / perCallMillis;
        if (fitting < properties.getBatchSize()) {
            log.debug("Claim limited by lease: batchSize={}, lease={}, fitting={}",
                    properties.getBatchSize(), properties.getLease(), fitting);
        }
        return (int) Math.max(1, Math.min(properties.getBatchSize(), fitting));
    }

    /**
     * {@code checkInterval * 2^(streak-1)}, capped at {@code maxBackoff}.
     */
    Duration backoff(int unavailableStreak) {
        int shift = Math.min(Math.max(unavailableStreak - 1, 0), MAX_BACKOFF_SHIFT);
        Duration candidate = properties.getCheckInterval().multipliedBy(1L << shift);
        return candidate.compareTo(properties.getMaxBackoff()) > 0 ? properties.getMaxBackoff() : candidate;
    }

    private int maxAttempts(QueueEntry entry) {
        return entry.getMaxAttempts() > 0 ? entry.getMaxAttempts() : properties.getMaxAttempts();
    }

    private static final class Counters {
        int claimed;
        int resolved;
        int rescheduled;
        int exhausted;
        int dropped;
        int errors;

        ReconciliationTickResult toResult() {
            return ReconciliationTickResult.builder()
                    .claimed(claimed)
                    .resolved(resolved)
                    .rescheduled(rescheduled)
                    .exhausted(exhausted)
                    .dropped(dropped)
                    .errors(errors)
                    .build();
        }
    }
}
