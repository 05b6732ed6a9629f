package com.payment.lifecycle.core;

import com.payment.lifecycle.domain.PaymentKind;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.StatusSource;
import com.payment.lifecycle.domain.TransactionStatus;
import com.payment.lifecycle.ledger.TransactionResolvedEvent;
import com.payment.lifecycle.messaging.PaymentStatusEventProducer;
import com.payment.lifecycle.queue.ReconciliationQueue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TransactionResolvedListenerTest {

    private static final String REF = "CINETPAY_42_7_20260301101530000_AB2C";

    @Mock
    private ReconciliationQueue queue;

    @Mock
    private PaymentStatusEventProducer eventProducer;

    @InjectMocks
    private TransactionResolvedListener listener;

    @Test
    void resolvedTransactionIsDequeuedAndPublished() {
        PaymentTransaction tx = accepted();

        listener.onResolved(new TransactionResolvedEvent(tx, TransactionStatus.PENDING, StatusSource.WEBHOOK));

        verify(queue).remove(REF);
        verify(eventProducer).publishStatusChanged(tx, StatusSource.WEBHOOK);
    }

    @Test
    void queueOutageStillPublishes() {
        PaymentTransaction tx = accepted();
        doThrow(new QueryTimeoutException("redis down")).when(queue).remove(REF);

        listener.onResolved(new TransactionResolvedEvent(tx, TransactionStatus.PENDING, StatusSource.WORKER));

        verify(eventProducer).publishStatusChanged(tx, StatusSource.WORKER);
    }

    private static PaymentTransaction accepted() {
        return PaymentTransaction.builder()
                .id(1L)
                .externalReference(REF)
                .payerId(42L)
                .contextId(7L)
                .amount(5000L)
                .currency("XAF")
                .kind(PaymentKind.TUITION_FEE)
                .operator("CINETPAY")
                .status(TransactionStatus.ACCEPTED)
                .build();
    }
}
