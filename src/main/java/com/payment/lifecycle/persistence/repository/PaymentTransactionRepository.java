package com.payment.lifecycle.persistence.repository;

import com.payment.lifecycle.domain.TransactionStatus;
import com.payment.lifecycle.persistence.entity.PaymentTransactionEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for ledger rows.
 */
@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransactionEntity, Long> {

    Optional<PaymentTransactionEntity> findByExternalReference(String externalReference);

    boolean existsByExternalReference(String externalReference);

    List<PaymentTransactionEntity> findByPayerIdOrderByCreatedAtDesc(Long payerId);

    Page<PaymentTransactionEntity> findByStatus(TransactionStatus status, Pageable pageable);

    long countByStatus(TransactionStatus status);

    /**
     * Atomic read-modify-write of the status: only succeeds while the row is still in
     * {@code expected}. Two concurrent resolvers both observing PENDING cannot both win.
     *
     * @return 1 if this caller performed the transition, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PaymentTransactionEntity t SET t.status = :newStatus, t.updatedAt = :now " +
            "WHERE t.externalReference = :reference AND t.status = :expected")
    int compareAndSetStatus(@Param("reference") String reference,
                            @Param("expected") TransactionStatus expected,
                            @Param("newStatus") TransactionStatus newStatus,
                            @Param("now") Instant now);

    @Query("SELECT t.currency, SUM(t.amount) FROM PaymentTransactionEntity t " +
            "WHERE t.status = :status GROUP BY t.currency")
    List<Object[]> sumAmountByCurrency(@Param("status") TransactionStatus status);
}
