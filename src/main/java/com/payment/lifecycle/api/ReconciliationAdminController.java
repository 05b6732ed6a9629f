package com.payment.lifecycle.api;

import com.payment.lifecycle.domain.PaymentStatistics;
import com.payment.lifecycle.ledger.TransactionLedger;
import com.payment.lifecycle.queue.QueueRecoveryService;
import com.payment.lifecycle.queue.ReconciliationQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator endpoints: ledger statistics and reconciliation queue maintenance.
 */
@Slf4j
@RestController
@RequestMapping("/payments")
@RequiredArgsConstructor
@Tag(name = "Payments admin", description = "Statistics and reconciliation queue maintenance")
public class ReconciliationAdminController {

    private final TransactionLedger ledger;
    private final ReconciliationQueue queue;
    private final QueueRecoveryService recoveryService;

    @GetMapping("/stats")
    @Operation(summary = "Payment statistics", description = "Counts per status and accepted totals per currency.")
    public PaymentStatistics statistics() {
        return ledger.statistics();
    }

    @GetMapping("/reconciliation/queue")
    @Operation(summary = "Reconciliation queue depth")
    public ReconciliationQueueDto queue() {
        return ReconciliationQueueDto.builder()
                .queued(queue.size())
                .pendingInLedger(ledger.statistics().getPending())
                .build();
    }

    @PostMapping("/reconciliation/rebuild")
    @Operation(summary = "Rebuild reconciliation queue",
            description = "Re-enqueues every PENDING transaction missing from the queue with zero attempts.")
    public Map<String, Object> rebuild() {
        log.info("Reconciliation queue rebuild requested");
        int restored = recoveryService.rebuild();
        return Map.of("restored", restored, "queued", queue.size());
    }
}
