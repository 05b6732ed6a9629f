package com.payment.lifecycle.webhook;

/**
 * What an authenticated notification led to. All of them are acknowledged with 200.
 */
public enum WebhookOutcome {
    /** Verification produced a terminal status that this call wrote. */
    APPLIED,
    /** Transaction was already terminal, or another path resolved it first. */
    DUPLICATE,
    /** Gateway still reports the payment in progress. */
    STILL_PENDING,
    /** Gateway unreachable; the reconciliation entry was made due immediately. */
    DEFERRED
}
