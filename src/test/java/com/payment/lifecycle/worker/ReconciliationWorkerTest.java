package com.payment.lifecycle.worker;

import com.payment.lifecycle.api.GatewayUnavailableException;
import com.payment.lifecycle.compliance.ComplianceAuditLogger;
import com.payment.lifecycle.config.GatewayProperties;
import com.payment.lifecycle.config.ReconciliationProperties;
import com.payment.lifecycle.core.GatewayInvoker;
import com.payment.lifecycle.domain.GatewayMetadata;
import com.payment.lifecycle.domain.PaymentKind;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.StatusSource;
import com.payment.lifecycle.domain.TransactionStatus;
import com.payment.lifecycle.gateway.VerificationResult;
import com.payment.lifecycle.ledger.TransactionLedger;
import com.payment.lifecycle.queue.InMemoryReconciliationQueue;
import com.payment.lifecycle.queue.QueueEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationWorkerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Duration INTERVAL = Duration.ofSeconds(15);
    private static final String REF = "CINETPAY_42_7_20260301100000000_AB2C";

    @Mock
    private TransactionLedger ledger;

    @Mock
    private GatewayInvoker gatewayInvoker;

    @Mock
    private ComplianceAuditLogger auditLogger;

    private ReconciliationProperties properties;
    private GatewayProperties gatewayProperties;
    private InMemoryReconciliationQueue queue;
    private ReconciliationWorker worker;

    @BeforeEach
    void setUp() {
        properties = new ReconciliationProperties();
        properties.setCheckInterval(INTERVAL);
        properties.setMaxBackoff(Duration.ofMinutes(5));
        properties.setMaxAttempts(20);
        properties.setLease(Duration.ofSeconds(60));
        gatewayProperties = new GatewayProperties();
        gatewayProperties.setConnectTimeout(Duration.ofSeconds(5));
        gatewayProperties.setReadTimeout(Duration.ofSeconds(15));
        queue = new InMemoryReconciliationQueue(properties.getMaxAttempts(), properties.getLease());
        worker = new ReconciliationWorker(queue, ledger, gatewayInvoker, properties, auditLogger, gatewayProperties);
    }

    @Test
    void emptyQueueDoesNothing() {
        assertThat(worker.tick(T0)).isEqualTo(ReconciliationTickResult.EMPTY);
        verifyNoInteractions(ledger, gatewayInvoker);
    }

    @Test
    void entryIsNotCheckedBeforeItIsDue() {
        queue.enqueue(REF, T0.plus(INTERVAL));

        assertThat(worker.tick(T0).getClaimed()).isZero();
        verifyNoInteractions(gatewayInvoker);
    }

    @Test
    void resolvedVerificationIsAppliedAndDequeued() {
        queue.enqueue(REF, T0);
        GatewayMetadata metadata = GatewayMetadata.builder().paymentMethod("OM").build();
        when(ledger.findByReference(REF)).thenReturn(Optional.of(tx(TransactionStatus.PENDING)));
        when(gatewayInvoker.verify(REF)).thenReturn(VerificationResult.builder()
                .externalReference(REF).status(TransactionStatus.ACCEPTED).metadata(metadata).build());
        when(ledger.applyStatus(REF, TransactionStatus.ACCEPTED, metadata, StatusSource.WORKER))
                .thenReturn(tx(TransactionStatus.ACCEPTED));

        ReconciliationTickResult result = worker.tick(T0);

        assertThat(result.getResolved()).isEqualTo(1);
        assertThat(queue.find(REF)).isEmpty();
    }

    @Test
    void pendingVerificationIsRescheduledOneIntervalLater() {
        queue.enqueue(REF, T0);
        when(ledger.findByReference(REF)).thenReturn(Optional.of(tx(TransactionStatus.PENDING)));
        when(gatewayInvoker.verify(REF)).thenReturn(VerificationResult.pending(REF, "WAITING_CUSTOMER_PAYMENT"));

        ReconciliationTickResult result = worker.tick(T0);

        assertThat(result.getRescheduled()).isEqualTo(1);
        QueueEntry entry = queue.find(REF).orElseThrow();
        assertThat(entry.getAttempts()).isEqualTo(1);
        assertThat(entry.getNextCheckTime()).isEqualTo(T0.plus(INTERVAL));
        verify(ledger, never()).applyStatus(any(), any(), any(), any());
    }

    @Test
    void stuckPendingFailsAfterExactlyMaxAttemptsPolls() {
        queue.enqueue(REF, T0.plus(INTERVAL));
        when(ledger.findByReference(REF)).thenReturn(Optional.of(tx(TransactionStatus.PENDING)));
        when(gatewayInvoker.verify(REF)).thenReturn(VerificationResult.pending(REF, "PENDING"));

        Instant now = T0;
        for (int poll = 1; poll < 20; poll++) {
            now = now.plus(INTERVAL);
            assertThat(worker.tick(now).getRescheduled()).isEqualTo(1);
        }
        verify(ledger, never()).applyStatus(any(), any(), any(), any());

        now = now.plus(INTERVAL);
        ReconciliationTickResult last = worker.tick(now);

        assertThat(last.getExhausted()).isEqualTo(1);
        verify(gatewayInvoker, times(20)).verify(REF);
        ArgumentCaptor<GatewayMetadata> metadata = ArgumentCaptor.forClass(GatewayMetadata.class);
        verify(ledger).applyStatus(eq(REF), eq(TransactionStatus.FAILED), metadata.capture(), eq(StatusSource.WORKER));
        assertThat(metadata.getValue().getErrorMessage()).contains("20");
        verify(auditLogger).logAttemptsExhausted(REF, 20);
        assertThat(queue.find(REF)).isEmpty();
        assertThat(worker.tick(now.plus(INTERVAL))).isEqualTo(ReconciliationTickResult.EMPTY);
    }

    @Test
    void unavailableGatewayBacksOffWithoutConsumingAttempts() {
        queue.enqueue(REF, T0);
        when(ledger.findByReference(REF)).thenReturn(Optional.of(tx(TransactionStatus.PENDING)));
        when(gatewayInvoker.verify(REF)).thenThrow(new GatewayUnavailableException("down", "cinetpay", REF));

        worker.tick(T0);
        QueueEntry afterFirst = queue.find(REF).orElseThrow();
        assertThat(afterFirst.getAttempts()).isZero();
        assertThat(afterFirst.getUnavailableStreak()).isEqualTo(1);
        assertThat(afterFirst.getNextCheckTime()).isEqualTo(T0.plus(INTERVAL));

        Instant second = afterFirst.getNextCheckTime();
        worker.tick(second);
        QueueEntry afterSecond = queue.find(REF).orElseThrow();
        assertThat(afterSecond.getAttempts()).isZero();
        assertThat(afterSecond.getUnavailableStreak()).isEqualTo(2);
        assertThat(afterSecond.getNextCheckTime()).isEqualTo(second.plus(INTERVAL.multipliedBy(2)));
        verify(ledger, never()).applyStatus(any(), any(), any(), any());
    }

    @Test
    void longGatewayOutageNeverFailsTheTransaction() {
        queue.enqueue(REF, T0);
        when(ledger.findByReference(REF)).thenReturn(Optional.of(tx(TransactionStatus.PENDING)));
        when(gatewayInvoker.verify(REF)).thenThrow(new GatewayUnavailableException("circuit open", "cinetpay", REF));

        Instant now = T0;
        for (int tick = 0; tick < 40; tick++) {
            assertThat(worker.tick(now).getExhausted()).isZero();
            now = now.plus(Duration.ofMinutes(10));
        }

        verify(gatewayInvoker, times(40)).verify(REF);
        verify(ledger, never()).applyStatus(eq(REF), eq(TransactionStatus.FAILED), any(), any());
        verifyNoInteractions(auditLogger);
        QueueEntry entry = queue.find(REF).orElseThrow();
        assertThat(entry.getAttempts()).isZero();
        assertThat(entry.getUnavailableStreak()).isEqualTo(40);
    }

    @Test
    void answeredPollAfterOutageCountsAndResetsTheStreak() {
        queue.enqueue(REF, T0);
        when(ledger.findByReference(REF)).thenReturn(Optional.of(tx(TransactionStatus.PENDING)));
        when(gatewayInvoker.verify(REF))
                .thenThrow(new GatewayUnavailableException("down", "cinetpay", REF))
                .thenReturn(VerificationResult.pending(REF, "WAITING_CUSTOMER_PAYMENT"));

        worker.tick(T0);
        Instant second = queue.find(REF).orElseThrow().getNextCheckTime();
        worker.tick(second);

        QueueEntry entry = queue.find(REF).orElseThrow();
        assertThat(entry.getAttempts()).isEqualTo(1);
        assertThat(entry.getUnavailableStreak()).isZero();
        assertThat(entry.getNextCheckTime()).isEqualTo(second.plus(INTERVAL));
    }

    @Test
    void claimIsCutToWhatFitsInOneLease() {
        for (int i = 0; i < 10; i++) {
            queue.enqueue("REF-" + i, T0);
        }
        when(ledger.findByReference(any())).thenReturn(Optional.empty());

        ReconciliationTickResult result = worker.tick(T0);

        assertThat(worker.claimLimit()).isEqualTo(3);
        assertThat(result.getClaimed()).isEqualTo(3);
        assertThat(queue.size()).isEqualTo(7);
    }

    @Test
    void fullBatchIsClaimedWhenTheLeaseCoversIt() {
        properties.setLease(Duration.ofMinutes(4));

        assertThat(worker.claimLimit()).isEqualTo(10);

        gatewayProperties.setReadTimeout(Duration.ofMinutes(5));
        assertThat(worker.claimLimit()).isEqualTo(1);
    }

    @Test
    void backoffDoublesUntilCapped() {
        assertThat(worker.backoff(1)).isEqualTo(Duration.ofSeconds(15));
        assertThat(worker.backoff(2)).isEqualTo(Duration.ofSeconds(30));
        assertThat(worker.backoff(5)).isEqualTo(Duration.ofSeconds(240));
        assertThat(worker.backoff(6)).isEqualTo(Duration.ofMinutes(5));
        assertThat(worker.backoff(500)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void resolvedOrMissingRowsAreDropped() {
        queue.enqueue(REF, T0);
        queue.enqueue("ORPHAN", T0);
        when(ledger.findByReference(REF)).thenReturn(Optional.of(tx(TransactionStatus.ACCEPTED)));
        when(ledger.findByReference("ORPHAN")).thenReturn(Optional.empty());

        ReconciliationTickResult result = worker.tick(T0);

        assertThat(result.getDropped()).isEqualTo(2);
        assertThat(queue.size()).isZero();
        verifyNoInteractions(gatewayInvoker);
    }

    @Test
    void unexpectedErrorKeepsEntryLeasedForRetry() {
        queue.enqueue(REF, T0);
        when(ledger.findByReference(REF)).thenThrow(new IllegalStateException("db hiccup"));

        ReconciliationTickResult result = worker.tick(T0);

        assertThat(result.getErrors()).isEqualTo(1);
        QueueEntry entry = queue.find(REF).orElseThrow();
        assertThat(entry.getAttempts()).isZero();
        assertThat(entry.getNextCheckTime()).isEqualTo(T0.plus(properties.getLease()));
    }

    @Test
    void verifyNowAppliesWithoutConsumingAnAttempt() {
        queue.enqueue(REF, T0.plus(INTERVAL));
        when(ledger.getByReference(REF)).thenReturn(tx(TransactionStatus.PENDING));
        when(gatewayInvoker.verify(REF)).thenReturn(VerificationResult.builder()
                .externalReference(REF).status(TransactionStatus.REFUSED).metadata(GatewayMetadata.EMPTY).build());
        when(ledger.applyStatus(REF, TransactionStatus.REFUSED, GatewayMetadata.EMPTY, StatusSource.MANUAL))
                .thenReturn(tx(TransactionStatus.REFUSED));

        PaymentTransaction result = worker.verifyNow(REF);

        assertThat(result.getStatus()).isEqualTo(TransactionStatus.REFUSED);
        assertThat(queue.find(REF)).isEmpty();
    }

    @Test
    void verifyNowOnPendingLeavesQueueUntouched() {
        queue.enqueue(REF, T0.plus(INTERVAL));
        when(ledger.getByReference(REF)).thenReturn(tx(TransactionStatus.PENDING));
        when(gatewayInvoker.verify(REF)).thenReturn(VerificationResult.pending(REF, "PENDING"));

        assertThat(worker.verifyNow(REF).getStatus()).isEqualTo(TransactionStatus.PENDING);
        assertThat(queue.find(REF).orElseThrow().getAttempts()).isZero();
    }

    private static PaymentTransaction tx(TransactionStatus status) {
        return PaymentTransaction.builder()
                .id(1L)
                .externalReference(REF)
                .payerId(42L)
                .contextId(7L)
                .amount(5000L)
                .currency("XAF")
                .kind(PaymentKind.TUITION_FEE)
                .operator("CINETPAY")
                .status(status)
                .build();
    }
}
