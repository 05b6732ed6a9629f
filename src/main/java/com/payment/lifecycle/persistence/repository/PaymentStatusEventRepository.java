package com.payment.lifecycle.persistence.repository;

import com.payment.lifecycle.persistence.entity.PaymentStatusEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the status history.
 */
@Repository
public interface PaymentStatusEventRepository extends JpaRepository<PaymentStatusEventEntity, Long> {

    List<PaymentStatusEventEntity> findByExternalReferenceOrderByOccurredAtAsc(String externalReference);
}
