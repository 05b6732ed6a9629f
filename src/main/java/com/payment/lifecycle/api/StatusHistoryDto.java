package com.payment.lifecycle.api;

import com.payment.lifecycle.domain.StatusSource;
import com.payment.lifecycle.domain.TransactionStatus;
import com.payment.lifecycle.persistence.entity.PaymentStatusEventEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class StatusHistoryDto {

    TransactionStatus fromStatus;
    TransactionStatus toStatus;
    StatusSource source;
    String message;
    Instant occurredAt;

    public static StatusHistoryDto from(PaymentStatusEventEntity entity) {
        return StatusHistoryDto.builder()
                .fromStatus(entity.getFromStatus())
                .toStatus(entity.getToStatus())
                .source(entity.getSource())
                .message(entity.getMessage())
                .occurredAt(entity.getOccurredAt())
                .build();
    }
}
