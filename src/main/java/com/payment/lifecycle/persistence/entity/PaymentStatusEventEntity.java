package com.payment.lifecycle.persistence.entity;

import com.payment.lifecycle.domain.StatusSource;
import com.payment.lifecycle.domain.TransactionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Status history of a transaction. Only effective writes are recorded: creation
 * at PENDING and the single transition to a terminal status.
 */
@Entity
@Table(name = "payment_status_events", indexes = {
    @Index(name = "idx_status_event_reference", columnList = "external_reference"),
    @Index(name = "idx_status_event_occurred_at", columnList = "occurred_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentStatusEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_reference", nullable = false, length = 120)
    private String externalReference;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 16)
    private TransactionStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, length = 16)
    private TransactionStatus toStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private StatusSource source;

    @Column(name = "message", length = 1000)
    private String message;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
