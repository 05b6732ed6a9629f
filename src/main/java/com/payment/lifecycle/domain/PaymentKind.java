package com.payment.lifecycle.domain;

/**
 * What a payment funds. Immutable once the transaction is created.
 */
public enum PaymentKind {
    /** Enrollment / application fee for a training session. */
    REGISTRATION_FEE,
    /** Tuition for the training itself. */
    TUITION_FEE
}
