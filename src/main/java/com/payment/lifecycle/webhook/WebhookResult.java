package com.payment.lifecycle.webhook;

import com.payment.lifecycle.domain.TransactionStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WebhookResult {

    String externalReference;
    WebhookOutcome outcome;
    /** Ledger status after processing. */
    TransactionStatus status;
}
