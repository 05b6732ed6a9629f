package com.payment.lifecycle.api;

/**
 * Currency is not accepted by the configured gateway. Nothing is persisted.
 */
public class UnsupportedCurrencyException extends PaymentLifecycleException {

    public UnsupportedCurrencyException(String currency) {
        super("Currency not supported by gateway: " + currency);
    }

    @Override
    public String getErrorKind() {
        return "UNSUPPORTED_CURRENCY";
    }
}
