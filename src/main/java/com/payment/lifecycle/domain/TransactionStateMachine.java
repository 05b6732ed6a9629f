package com.payment.lifecycle.domain;

import java.util.Objects;

/**
 * Transition table shared by the webhook path and the reconciliation worker.
 * <pre>
 * PENDING  -> ACCEPTED | REFUSED | FAILED   applied
 * PENDING  -> PENDING                       unchanged
 * terminal -> anything                      ignored (duplicate resolution)
 * </pre>
 * Illegal requests are never errors: they resolve to a no-op so that two
 * concurrent resolutions of the same transaction converge on the first one.
 */
public final class TransactionStateMachine {

    private TransactionStateMachine() {}

    public static Transition transition(TransactionStatus from, TransactionStatus to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.isTerminal()) {
            return Transition.IGNORED_TERMINAL;
        }
        return to == TransactionStatus.PENDING ? Transition.UNCHANGED : Transition.APPLIED;
    }

    public static boolean canTransition(TransactionStatus from, TransactionStatus to) {
        return transition(from, to).requiresWrite();
    }
}
