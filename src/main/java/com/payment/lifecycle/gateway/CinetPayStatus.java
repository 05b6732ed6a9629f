package com.payment.lifecycle.gateway;

import com.payment.lifecycle.domain.TransactionStatus;

import java.util.Locale;

/**
 * Status vocabulary returned by the CinetPay check endpoint.
 */
public enum CinetPayStatus {

    ACCEPTED,
    REFUSED,
    CANCELED,
    PENDING,
    WAITING_CUSTOMER_PAYMENT,
    WAITING_CUSTOMER_TO_VALIDATE,
    WAITING_CUSTOMER_OTP_CODE,
    /** Anything this enum does not list. */
    UNKNOWN;

    public static CinetPayStatus fromVendor(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if ("CANCELLED".equals(normalized)) {
            return CANCELED;
        }
        try {
            return CinetPayStatus.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    /**
     * Canonical status for this vendor status. Unrecognized statuses stay PENDING so the
     * worker keeps polling; only the attempt budget can turn them into FAILED.
     */
    public TransactionStatus toTransactionStatus() {
        switch (this) {
            case ACCEPTED:
                return TransactionStatus.ACCEPTED;
            case REFUSED:
            case CANCELED:
                return TransactionStatus.REFUSED;
            case PENDING:
            case WAITING_CUSTOMER_PAYMENT:
            case WAITING_CUSTOMER_TO_VALIDATE:
            case WAITING_CUSTOMER_OTP_CODE:
            case UNKNOWN:
                return TransactionStatus.PENDING;
            default:
                throw new IllegalStateException("Unhandled CinetPay status " + this);
        }
    }
}
