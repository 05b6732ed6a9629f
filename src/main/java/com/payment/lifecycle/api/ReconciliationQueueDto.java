package com.payment.lifecycle.api;

import lombok.Builder;
import lombok.Value;

/**
 * Queue depth for operators, next to the ledger's PENDING count. The two should match
 * once the queue has been rebuilt.
 */
@Value
@Builder
public class ReconciliationQueueDto {

    long queued;
    long pendingInLedger;
}
