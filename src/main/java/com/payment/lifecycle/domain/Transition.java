package com.payment.lifecycle.domain;

/**
 * Outcome of checking a requested status change against {@link TransactionStateMachine}.
 */
public enum Transition {
    /** PENDING to a terminal status: the write must be performed. */
    APPLIED,
    /** PENDING to PENDING: nothing to write, the queue entry is rescheduled. */
    UNCHANGED,
    /** Any change requested from a terminal status: a duplicate resolution, ignored. */
    IGNORED_TERMINAL;

    public boolean requiresWrite() {
        return this == APPLIED;
    }
}
