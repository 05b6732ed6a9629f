package com.payment.lifecycle.ledger;

import com.payment.lifecycle.api.DuplicateReferenceException;
import com.payment.lifecycle.api.InvalidAmountException;
import com.payment.lifecycle.api.TransactionNotFoundException;
import com.payment.lifecycle.api.UnsupportedCurrencyException;
import com.payment.lifecycle.compliance.ComplianceAuditLogger;
import com.payment.lifecycle.config.GatewayProperties;
import com.payment.lifecycle.domain.GatewayMetadata;
import com.payment.lifecycle.domain.PaymentKind;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.StatusSource;
import com.payment.lifecycle.domain.TransactionStatus;
import com.payment.lifecycle.persistence.entity.PaymentStatusEventEntity;
import com.payment.lifecycle.persistence.entity.PaymentTransactionEntity;
import com.payment.lifecycle.persistence.repository.PaymentStatusEventRepository;
import com.payment.lifecycle.persistence.repository.PaymentTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TransactionLedger with mocked repositories.
 */
@ExtendWith(MockitoExtension.class)
class TransactionLedgerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    private static final String REF = "CINETPAY_42_7_20260301101530000_AB2C";

    @Mock
    private PaymentTransactionRepository transactionRepository;

    @Mock
    private PaymentStatusEventRepository statusEventRepository;

    @Mock
    private ReferenceGenerator referenceGenerator;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private ComplianceAuditLogger auditLogger;

    private TransactionLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new TransactionLedger(transactionRepository, statusEventRepository, referenceGenerator,
                new GatewayProperties(), eventPublisher, auditLogger, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createPersistsPendingRowWithGeneratedReference() {
        when(referenceGenerator.generate("CINETPAY", 42L, 7L)).thenReturn(REF);
        when(transactionRepository.existsByExternalReference(REF)).thenReturn(false);
        when(transactionRepository.saveAndFlush(any(PaymentTransactionEntity.class))).thenAnswer(inv -> {
            PaymentTransactionEntity e = inv.getArgument(0);
            e.setId(1L);
            return e;
        });

        PaymentTransaction tx = ledger.create(intent(5000L, "xaf"));

        assertThat(tx.getId()).isEqualTo(1L);
        assertThat(tx.getExternalReference()).isEqualTo(REF);
        assertThat(tx.getStatus()).isEqualTo(TransactionStatus.PENDING);
        assertThat(tx.getCurrency()).isEqualTo("XAF");
        assertThat(tx.getOperator()).isEqualTo("CINETPAY");
        assertThat(tx.getDescription()).isEqualTo("TUITION_FEE payment");

        ArgumentCaptor<PaymentStatusEventEntity> history = ArgumentCaptor.forClass(PaymentStatusEventEntity.class);
        verify(statusEventRepository).save(history.capture());
        assertThat(history.getValue().getFromStatus()).isNull();
        assertThat(history.getValue().getToStatus()).isEqualTo(TransactionStatus.PENDING);
        assertThat(history.getValue().getSource()).isEqualTo(StatusSource.INITIATION);
        verify(auditLogger).logCreated(tx);
    }

    @Test
    void negativeAmountIsRejectedAndNothingIsPersisted() {
        assertThatThrownBy(() -> ledger.create(intent(-100L, "XAF")))
                .isInstanceOf(InvalidAmountException.class);

        verifyNoInteractions(transactionRepository, statusEventRepository, referenceGenerator);
    }

    @Test
    void zeroAmountIsRejected() {
        assertThatThrownBy(() -> ledger.create(intent(0L, "XAF")))
                .isInstanceOf(InvalidAmountException.class);
    }

    @Test
    void unsupportedCurrencyIsRejected() {
        assertThatThrownBy(() -> ledger.create(intent(5000L, "GBP")))
                .isInstanceOf(UnsupportedCurrencyException.class);

        verifyNoInteractions(transactionRepository);
    }

    @Test
    void existingReferenceIsReportedAsDuplicate() {
        when(referenceGenerator.generate(anyString(), any(), any())).thenReturn(REF);
        when(transactionRepository.existsByExternalReference(REF)).thenReturn(true);

        assertThatThrownBy(() -> ledger.create(intent(5000L, "XAF")))
                .isInstanceOf(DuplicateReferenceException.class);
        verify(transactionRepository, never()).saveAndFlush(any());
    }

    @Test
    void uniqueIndexViolationIsReportedAsDuplicate() {
        when(referenceGenerator.generate(anyString(), any(), any())).thenReturn(REF);
        when(transactionRepository.existsByExternalReference(REF)).thenReturn(false);
        when(transactionRepository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("unique"));

        assertThatThrownBy(() -> ledger.create(intent(5000L, "XAF")))
                .isInstanceOf(DuplicateReferenceException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
        verify(statusEventRepository, never()).save(any());
    }

    @Test
    void applyStatusWritesTransitionAndPublishesResolvedEvent() {
        when(transactionRepository.findByExternalReference(REF))
                .thenReturn(Optional.of(entity(TransactionStatus.PENDING)))
                .thenReturn(Optional.of(entity(TransactionStatus.ACCEPTED)));
        when(transactionRepository.compareAndSetStatus(REF, TransactionStatus.PENDING, TransactionStatus.ACCEPTED, NOW))
                .thenReturn(1);
        when(transactionRepository.save(any(PaymentTransactionEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        GatewayMetadata metadata = GatewayMetadata.builder().paymentMethod("OM").operatorTransactionId("op-1").build();
        PaymentTransaction result = ledger.applyStatus(REF, TransactionStatus.ACCEPTED, metadata, StatusSource.WEBHOOK);

        assertThat(result.getStatus()).isEqualTo(TransactionStatus.ACCEPTED);
        assertThat(result.getMetadata().getPaymentMethod()).isEqualTo("OM");
        ArgumentCaptor<TransactionResolvedEvent> event = ArgumentCaptor.forClass(TransactionResolvedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getPreviousStatus()).isEqualTo(TransactionStatus.PENDING);
        assertThat(event.getValue().getSource()).isEqualTo(StatusSource.WEBHOOK);
        verify(auditLogger).logTransition(result, TransactionStatus.PENDING, StatusSource.WEBHOOK);
    }

    @Test
    void applyStatusOnTerminalRowIsIgnored() {
        when(transactionRepository.findByExternalReference(REF)).thenReturn(Optional.of(entity(TransactionStatus.ACCEPTED)));

        PaymentTransaction result = ledger.applyStatus(REF, TransactionStatus.REFUSED, null, StatusSource.WORKER);

        assertThat(result.getStatus()).isEqualTo(TransactionStatus.ACCEPTED);
        verify(transactionRepository, never()).compareAndSetStatus(any(), any(), any(), any());
        verifyNoInteractions(eventPublisher, statusEventRepository);
        verify(auditLogger).logDuplicateResolution(REF, TransactionStatus.ACCEPTED, TransactionStatus.REFUSED, StatusSource.WORKER);
    }

    @Test
    void applyPendingDoesNotWrite() {
        when(transactionRepository.findByExternalReference(REF)).thenReturn(Optional.of(entity(TransactionStatus.PENDING)));

        PaymentTransaction result = ledger.applyStatus(REF, TransactionStatus.PENDING, null, StatusSource.WORKER);

        assertThat(result.getStatus()).isEqualTo(TransactionStatus.PENDING);
        verify(transactionRepository, never()).compareAndSetStatus(any(), any(), any(), any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void losingTheConditionalUpdateIsNotAppliedAndReturnsTheWinnersStatus() {
        when(transactionRepository.findByExternalReference(REF))
                .thenReturn(Optional.of(entity(TransactionStatus.PENDING)))
                .thenReturn(Optional.of(entity(TransactionStatus.ACCEPTED)));
        when(transactionRepository.compareAndSetStatus(REF, TransactionStatus.PENDING, TransactionStatus.REFUSED, NOW))
                .thenReturn(0);

        StatusChange change = ledger.applyStatusChange(REF, TransactionStatus.REFUSED, null, StatusSource.WORKER);

        assertThat(change.isApplied()).isFalse();
        assertThat(change.getTransaction().getStatus()).isEqualTo(TransactionStatus.ACCEPTED);
        verifyNoInteractions(eventPublisher, statusEventRepository);
    }

    @Test
    void applyStatusOnUnknownReferenceThrowsNotFound() {
        when(transactionRepository.findByExternalReference("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledger.applyStatus("missing", TransactionStatus.ACCEPTED, null, StatusSource.WEBHOOK))
                .isInstanceOf(TransactionNotFoundException.class);
    }

    @Test
    void attachMetadataKeepsExistingValues() {
        PaymentTransactionEntity row = entity(TransactionStatus.PENDING);
        row.setPaymentUrl("https://pay/first");
        when(transactionRepository.findByExternalReference(REF)).thenReturn(Optional.of(row));
        when(transactionRepository.save(any(PaymentTransactionEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        PaymentTransaction result = ledger.attachMetadata(REF, GatewayMetadata.builder()
                .paymentUrl("https://pay/second")
                .operatorToken("tok")
                .build());

        assertThat(result.getMetadata().getPaymentUrl()).isEqualTo("https://pay/first");
        assertThat(result.getMetadata().getOperatorToken()).isEqualTo("tok");
    }

    @Test
    void statisticsGroupAcceptedAmountsPerCurrency() {
        when(transactionRepository.countByStatus(TransactionStatus.PENDING)).thenReturn(2L);
        when(transactionRepository.countByStatus(TransactionStatus.ACCEPTED)).thenReturn(3L);
        when(transactionRepository.countByStatus(TransactionStatus.REFUSED)).thenReturn(1L);
        when(transactionRepository.countByStatus(TransactionStatus.FAILED)).thenReturn(0L);
        when(transactionRepository.sumAmountByCurrency(eq(TransactionStatus.ACCEPTED)))
                .thenReturn(List.of(new Object[]{"XAF", 15000L}, new Object[]{"EUR", 2500L}));

        var stats = ledger.statistics();

        assertThat(stats.getTotal()).isEqualTo(6L);
        assertThat(stats.getAccepted()).isEqualTo(3L);
        assertThat(stats.getAcceptedAmountByCurrency()).containsEntry("XAF", 15000L).containsEntry("EUR", 2500L);
    }

    private static PaymentIntent intent(long amount, String currency) {
        return PaymentIntent.builder()
                .payerId(42L)
                .contextId(7L)
                .amount(amount)
                .currency(currency)
                .kind(PaymentKind.TUITION_FEE)
                .build();
    }

    private static PaymentTransactionEntity entity(TransactionStatus status) {
        return PaymentTransactionEntity.builder()
                .id(1L)
                .externalReference(REF)
                .payerId(42L)
                .contextId(7L)
                .amount(5000L)
                .currency("XAF")
                .kind(PaymentKind.TUITION_FEE)
                .operator("CINETPAY")
                .status(status)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
