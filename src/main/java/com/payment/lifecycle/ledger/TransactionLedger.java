package com.payment.lifecycle.ledger;

import com.payment.lifecycle.api.DuplicateReferenceException;
import com.payment.lifecycle.api.InvalidAmountException;
import com.payment.lifecycle.api.TransactionNotFoundException;
import com.payment.lifecycle.api.UnsupportedCurrencyException;
import com.payment.lifecycle.compliance.ComplianceAuditLogger;
import com.payment.lifecycle.config.GatewayProperties;
import com.payment.lifecycle.domain.GatewayMetadata;
import com.payment.lifecycle.domain.PaymentStatistics;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.StatusSource;
import com.payment.lifecycle.domain.TransactionStateMachine;
import com.payment.lifecycle.domain.TransactionStatus;
import com.payment.lifecycle.domain.Transition;
import com.payment.lifecycle.persistence.entity.PaymentStatusEventEntity;
import com.payment.lifecycle.persistence.entity.PaymentTransactionEntity;
import com.payment.lifecycle.persistence.repository.PaymentStatusEventRepository;
import com.payment.lifecycle.persistence.repository.PaymentTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Durable record of every payment attempt and the single source of truth for its status.
 * {@link #applyStatus} is the only mutator after creation; illegal transitions return the
 * unchanged row instead of failing, which makes webhook and worker resolutions commute.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionLedger {

    private static final int MAX_MESSAGE_LENGTH = 1000;

    private final PaymentTransactionRepository transactionRepository;
    private final PaymentStatusEventRepository statusEventRepository;
    private final ReferenceGenerator referenceGenerator;
    private final GatewayProperties gatewayProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final ComplianceAuditLogger auditLogger;
    private final Clock clock;

    /**
     * Inserts a PENDING row with a freshly generated external reference.
     *
     * @throws InvalidAmountException       amount is not positive
     * @throws UnsupportedCurrencyException currency not accepted by the gateway
     * @throws DuplicateReferenceException  the generated reference already exists
     */
    @Transactional
    public PaymentTransaction create(PaymentIntent intent) {
        if (intent.getAmount() <= 0) {
            throw new InvalidAmountException(intent.getAmount());
        }
        if (intent.getPayerId() == null || intent.getContextId() == null || intent.getKind() == null) {
            throw new IllegalArgumentException("payerId, contextId and kind are required");
        }
        if (!gatewayProperties.supportsCurrency(intent.getCurrency())) {
            throw new UnsupportedCurrencyException(intent.getCurrency());
        }

        String operator = gatewayProperties.getOperator();
        String reference = referenceGenerator.generate(operator, intent.getPayerId(), intent.getContextId());
        if (transactionRepository.existsByExternalReference(reference)) {
            throw new DuplicateReferenceException(reference, null);
        }

        Instant now = clock.instant();
        PaymentTransactionEntity entity = PaymentTransactionEntity.builder()
                .externalReference(reference)
                .payerId(intent.getPayerId())
                .contextId(intent.getContextId())
                .amount(intent.getAmount())
                .currency(intent.getCurrency().toUpperCase(Locale.ROOT))
                .kind(intent.getKind())
                .description(intent.getDescription() != null && !intent.getDescription().isBlank()
                        ? intent.getDescription()
                        : intent.getKind().name() + " payment")
                .operator(operator)
                .status(TransactionStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            entity = transactionRepository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException e) {
            log.warn("External reference collision on insert: reference={}", reference);
            throw new DuplicateReferenceException(reference, e);
        }

        recordHistory(reference, null, TransactionStatus.PENDING, StatusSource.INITIATION, null, now);
        PaymentTransaction created = toDomain(entity);
        auditLogger.logCreated(created);
        return created;
    }

    @Transactional(readOnly = true)
    public PaymentTransaction get(Long id) {
        return transactionRepository.findById(id)
                .map(TransactionLedger::toDomain)
                .orElseThrow(() -> TransactionNotFoundException.byId(id));
    }

    @Transactional(readOnly = true)
    public PaymentTransaction getByReference(String externalReference) {
        return findByReference(externalReference)
                .orElseThrow(() -> TransactionNotFoundException.byReference(externalReference));
    }

    @Transactional(readOnly = true)
    public Optional<PaymentTransaction> findByReference(String externalReference) {
        return transactionRepository.findByExternalReference(externalReference).map(TransactionLedger::toDomain);
    }

    @Transactional(readOnly = true)
    public List<PaymentTransaction> listByPayer(Long payerId) {
        return transactionRepository.findByPayerIdOrderByCreatedAtDesc(payerId).stream()
                .map(TransactionLedger::toDomain)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Page<PaymentTransaction> findPending(Pageable pageable) {
        return transactionRepository.findByStatus(TransactionStatus.PENDING, pageable).map(TransactionLedger::toDomain);
    }

    /**
     * Moves a transaction to {@code newStatus} if the state machine allows it, otherwise
     * returns the row unchanged. The write is a conditional update on {@code status = PENDING},
     * so when two callers race only one performs the transition and publishes the
     * {@link TransactionResolvedEvent}.
     */
    @Transactional
    public PaymentTransaction applyStatus(String externalReference, TransactionStatus newStatus,
                                          GatewayMetadata metadata, StatusSource source) {
        return applyStatusChange(externalReference, newStatus, metadata, source).getTransaction();
    }

    /**
     * Same as {@link #applyStatus}, also telling whether this call performed the write.
     */
    @Transactional
    public StatusChange applyStatusChange(String externalReference, TransactionStatus newStatus,
                                          GatewayMetadata metadata, StatusSource source) {
        PaymentTransactionEntity current = transactionRepository.findByExternalReference(externalReference)
                .orElseThrow(() -> TransactionNotFoundException.byReference(externalReference));

        Transition transition = TransactionStateMachine.transition(current.getStatus(), newStatus);
        switch (transition) {
            case IGNORED_TERMINAL:
                log.info("Duplicate resolution ignored: reference={}, current={}, requested={}, source={}",
                        externalReference, current.getStatus(), newStatus, source);
                auditLogger.logDuplicateResolution(externalReference, current.getStatus(), newStatus, source);
                return StatusChange.unchanged(toDomain(current));
            case UNCHANGED:
                log.debug("Transaction still pending: reference={}, source={}", externalReference, source);
                return StatusChange.unchanged(toDomain(current));
            case APPLIED:
            default:
                break;
        }

        Instant now = clock.instant();
        int updated = transactionRepository.compareAndSetStatus(
                externalReference, TransactionStatus.PENDING, newStatus, now);
        PaymentTransactionEntity fresh = transactionRepository.findByExternalReference(externalReference)
                .orElseThrow(() -> TransactionNotFoundException.byReference(externalReference));
        if (updated == 0) {
            log.info("Lost resolution race: reference={}, stored={}, requested={}, source={}",
                    externalReference, fresh.getStatus(), newStatus, source);
            auditLogger.logDuplicateResolution(externalReference, fresh.getStatus(), newStatus, source);
            return StatusChange.unchanged(toDomain(fresh));
        }

        if (fresh.mergeMetadata(metadata)) {
            fresh = transactionRepository.save(fresh);
        }
        String message = metadata != null ? metadata.getErrorMessage() : null;
        recordHistory(externalReference, TransactionStatus.PENDING, newStatus, source, message, now);

        PaymentTransaction resolved = toDomain(fresh);
        auditLogger.logTransition(resolved, TransactionStatus.PENDING, source);
        eventPublisher.publishEvent(new TransactionResolvedEvent(resolved, TransactionStatus.PENDING, source));
        return StatusChange.applied(resolved);
    }

    /**
     * Adds gateway metadata without touching the status. Fields already set are kept.
     */
    @Transactional
    public PaymentTransaction attachMetadata(String externalReference, GatewayMetadata metadata) {
        PaymentTransactionEntity entity = transactionRepository.findByExternalReference(externalReference)
                .orElseThrow(() -> TransactionNotFoundException.byReference(externalReference));
        if (entity.mergeMetadata(metadata)) {
            entity.setUpdatedAt(clock.instant());
            entity = transactionRepository.save(entity);
        }
        return toDomain(entity);
    }

    @Transactional(readOnly = true)
    public List<PaymentStatusEventEntity> history(String externalReference) {
        return statusEventRepository.findByExternalReferenceOrderByOccurredAtAsc(externalReference);
    }

    @Transactional(readOnly = true)
    public PaymentStatistics statistics() {
        long pending = transactionRepository.countByStatus(TransactionStatus.PENDING);
        long accepted = transactionRepository.countByStatus(TransactionStatus.ACCEPTED);
        long refused = transactionRepository.countByStatus(TransactionStatus.REFUSED);
        long failed = transactionRepository.countByStatus(TransactionStatus.FAILED);
        Map<String, Long> acceptedByCurrency = new LinkedHashMap<>();
        for (Object[] row : transactionRepository.sumAmountByCurrency(TransactionStatus.ACCEPTED)) {
            acceptedByCurrency.put((String) row[0], row[1] != null ? ((Number) row[1]).longValue() : 0L);
        }
        return PaymentStatistics.builder()
                .total(pending + accepted + refused + failed)
                .pending(pending)
                .accepted(accepted)
                .refused(refused)
                .failed(failed)
                .acceptedAmountByCurrency(acceptedByCurrency)
                .build();
    }

    private void recordHistory(String reference, TransactionStatus from, TransactionStatus to,
                               StatusSource source, String message, Instant at) {
        statusEventRepository.save(PaymentStatusEventEntity.builder()
                .externalReference(reference)
                .fromStatus(from)
                .toStatus(to)
                .source(source)
                .message(message != null && message.length() > MAX_MESSAGE_LENGTH
                        ? message.substring(0, MAX_MESSAGE_LENGTH) : message)
                .occurredAt(at)
                .build());
    }

    static PaymentTransaction toDomain(PaymentTransactionEntity entity) {
        return PaymentTransaction.builder()
                .id(entity.getId())
                .externalReference(entity.getExternalReference())
                .payerId(entity.getPayerId())
                .contextId(entity.getContextId())
                .amount(entity.getAmount() != null ? entity.getAmount() : 0L)
                .currency(entity.getCurrency())
                .kind(entity.getKind())
                .description(entity.getDescription())
                .operator(entity.getOperator())
                .status(entity.getStatus())
                .metadata(entity.toMetadata())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
