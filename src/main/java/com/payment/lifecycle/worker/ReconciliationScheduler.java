package com.payment.lifecycle.worker;

import com.payment.lifecycle.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Hosts the reconciliation loop. {@code fixedDelay} keeps ticks from overlapping; on
 * shutdown no new tick starts and the scheduler waits for the running one
 * ({@code spring.task.scheduling.shutdown.await-termination}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationScheduler {

    private final ReconciliationWorker worker;
    private final ReconciliationProperties properties;
    private final Clock clock;

    private final AtomicBoolean accepting = new AtomicBoolean(true);

    @Scheduled(fixedDelayString = "${payment.reconciliation.tick-interval:PT15S}",
            initialDelayString = "${payment.reconciliation.tick-interval:PT15S}")
    public void runTick() {
        if (!properties.isEnabled() || !accepting.get()) {
            log.debug("Reconciliation disabled or stopping, skipping tick");
            return;
        }
        try {
            ReconciliationTickResult result = worker.tick(clock.instant());
            if (result.getClaimed() > 0) {
                log.info("Reconciliation tick: claimed={}, resolved={}, rescheduled={}, exhausted={}, dropped={}, errors={}",
                        result.getClaimed(), result.getResolved(), result.getRescheduled(),
                        result.getExhausted(), result.getDropped(), result.getErrors());
            }
        } catch (Exception e) {
            log.error("Reconciliation tick failed", e);
        }
    }

    @EventListener(ContextClosedEvent.class)
    public void stopAccepting() {
        if (accepting.compareAndSet(true, false)) {
            log.info("Reconciliation worker stopping: no new entries will be claimed");
        }
    }

    boolean isAccepting() {
        return accepting.get();
    }
}
