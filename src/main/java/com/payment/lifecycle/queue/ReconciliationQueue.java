package com.payment.lifecycle.queue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Time-ordered set of references awaiting a status check. Advisory only: the ledger is
 * authoritative and the queue can be rebuilt from its PENDING rows at any time.
 */
public interface ReconciliationQueue {

    /**
     * Adds an entry with zero attempts. No-op if the reference is already queued.
     *
     * @return true if a new entry was created
     */
    boolean enqueue(String externalReference, Instant firstCheckTime);

    /**
     * Claims up to {@code limit} entries due at {@code now}, oldest first. Claimed entries
     * are leased: their next check is pushed forward so a concurrent worker does not pick
     * them up while they are being verified.
     */
    List<QueueEntry> dueEntries(Instant now, int limit);

    /**
     * Updates attempts and next check time in place and clears the unavailable streak.
     * Does nothing if the entry was removed meanwhile.
     */
    default void reschedule(String externalReference, int attempts, Instant nextCheckTime) {
        reschedule(externalReference, attempts, 0, nextCheckTime);
    }

    /**
     * Same as {@link #reschedule(String, int, Instant)} with an explicit count of consecutive
     * checks that could not reach the gateway.
     */
    void reschedule(String externalReference, int attempts, int unavailableStreak, Instant nextCheckTime);

    /**
     * Makes the entry due at {@code now} without touching its attempts, creating it if missing.
     */
    void expedite(String externalReference, Instant now);

    void remove(String externalReference);

    Optional<QueueEntry> find(String externalReference);

    long size();
}
