package com.payment.lifecycle.queue;

import com.payment.lifecycle.config.ReconciliationProperties;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.ledger.TransactionLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Rebuilds the reconciliation queue from the ledger. Every PENDING row without a queue
 * entry is re-enqueued with zero attempts, due immediately. Existing entries keep their
 * attempt counts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueRecoveryService {

    private final TransactionLedger ledger;
    private final ReconciliationQueue queue;
    private final ReconciliationProperties properties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void rebuildOnStartup() {
        if (!properties.isEnabled() || !properties.isRebuildOnStartup()) {
            return;
        }
        try {
            rebuild();
        } catch (DataAccessException e) {
            log.error("Reconciliation queue rebuild on startup failed; the worker will only see new entries until the next rebuild", e);
        }
    }

    /**
     * @return number of references that were missing from the queue and have been added
     */
    public int rebuild() {
        Instant now = clock.instant();
        int scanned = 0;
        int restored = 0;
        int page = 0;
        Page<PaymentTransaction> pending;
        do {
            pending = ledger.findPending(PageRequest.of(page++, properties.getRebuildPageSize(), Sort.by("id")));
            for (PaymentTransaction tx : pending) {
                scanned++;
                if (queue.find(tx.getExternalReference()).isEmpty()
                        && queue.enqueue(tx.getExternalReference(), now)) {
                    restored++;
                }
            }
        } while (pending.hasNext());
        log.info("Reconciliation queue rebuilt: pendingScanned={}, restored={}", scanned, restored);
        return restored;
    }
}
