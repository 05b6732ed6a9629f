package com.payment.lifecycle.messaging;

import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.StatusSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes terminal status changes to Kafka. Fire-and-forget: delivery failures are
 * logged, never propagated into the status write that triggered them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentStatusEventProducer {

    private final KafkaTemplate<String, PaymentStatusEvent> kafkaTemplate;
    private final Clock clock;

    @Value("${payment.kafka.topic.status-events:payment-status-events}")
    private String topic;

    public void publishStatusChanged(PaymentTransaction tx, StatusSource source) {
        PaymentStatusEvent event = PaymentStatusEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .transactionId(tx.getId())
                .externalReference(tx.getExternalReference())
                .payerId(tx.getPayerId())
                .contextId(tx.getContextId())
                .kind(tx.getKind())
                .status(tx.getStatus())
                .amount(tx.getAmount())
                .currency(tx.getCurrency())
                .operator(tx.getOperator())
                .source(source)
                .timestamp(tx.getUpdatedAt() != null ? tx.getUpdatedAt() : clock.instant())
                .build();
        send(tx.getExternalReference(), event);
    }

    private void send(String key, PaymentStatusEvent event) {
        log.info("Publishing status event: key={}, eventId={}, status={}", key, event.getEventId(), event.getStatus());
        CompletableFuture<SendResult<String, PaymentStatusEvent>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (KafkaException e) {
            log.error("Failed to hand status event to Kafka key={} eventId={}", key, event.getEventId(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish status event key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published status event: key={}, eventId={}, partition={}, offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}
