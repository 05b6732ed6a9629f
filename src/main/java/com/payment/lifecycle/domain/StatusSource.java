package com.payment.lifecycle.domain;

/**
 * Which path produced a status write. Recorded in the status history and audit log.
 */
public enum StatusSource {
    INITIATION,
    WEBHOOK,
    WORKER,
    MANUAL
}
