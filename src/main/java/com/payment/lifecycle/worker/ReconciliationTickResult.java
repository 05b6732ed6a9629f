package com.payment.lifecycle.worker;

import lombok.Builder;
import lombok.Value;

/**
 * Counters for one worker tick.
 */
@Value
@Builder
public class ReconciliationTickResult {

    public static final ReconciliationTickResult EMPTY = ReconciliationTickResult.builder().build();

    /** Entries claimed from the queue. */
    int claimed;
    /** Moved to ACCEPTED or REFUSED by this tick. */
    int resolved;
    /** Still pending or gateway unavailable; put back with one more attempt. */
    int rescheduled;
    /** Ran out of attempts and were failed. */
    int exhausted;
    /** Removed without a gateway call: row missing or already terminal. */
    int dropped;
    /** Unexpected errors; the entry is retried once its lease expires. */
    int errors;
}
