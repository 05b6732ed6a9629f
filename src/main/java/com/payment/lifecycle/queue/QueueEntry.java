package com.payment.lifecycle.queue;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Reconciliation task for one PENDING transaction: when to check next and how many
 * checks have been spent so far. Only checks the gateway answered count as attempts;
 * {@code unavailableStreak} counts consecutive checks that could not reach it and drives
 * the backoff.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class QueueEntry {

    String externalReference;
    Instant nextCheckTime;
    int attempts;
    int maxAttempts;
    int unavailableStreak;

    public boolean isExhausted() {
        return attempts >= maxAttempts;
    }
}
