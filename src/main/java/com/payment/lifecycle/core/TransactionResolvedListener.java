package com.payment.lifecycle.core;

import com.payment.lifecycle.ledger.TransactionResolvedEvent;
import com.payment.lifecycle.messaging.PaymentStatusEventProducer;
import com.payment.lifecycle.queue.ReconciliationQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Side effects of a terminal transition, run once the status write has committed:
 * drop the reconciliation entry and notify downstream systems.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionResolvedListener {

    private final ReconciliationQueue queue;
    private final PaymentStatusEventProducer eventProducer;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onResolved(TransactionResolvedEvent event) {
        String reference = event.getTransaction().getExternalReference();
        try {
            queue.remove(reference);
        } catch (DataAccessException e) {
            // The worker drops entries whose ledger row is terminal.
            log.error("Could not remove resolved reference={} from reconciliation queue", reference, e);
        }
        eventProducer.publishStatusChanged(event.getTransaction(), event.getSource());
    }
}
