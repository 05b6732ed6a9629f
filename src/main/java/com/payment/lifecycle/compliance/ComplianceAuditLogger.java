package com.payment.lifecycle.compliance;

import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.domain.StatusSource;
import com.payment.lifecycle.domain.TransactionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Audit trail of the payment lifecycle written to the application log. Each line starts
 * with {@code [AUDIT]} so it can be routed to a dedicated retention sink. Credentials,
 * signatures and raw webhook bodies are never logged here.
 */
@Slf4j
@Component
public class ComplianceAuditLogger {

    public void logCreated(PaymentTransaction tx) {
        log.info("[AUDIT] PAYMENT_CREATED reference={} payerId={} contextId={} kind={} amount={} currency={} operator={}",
                tx.getExternalReference(), tx.getPayerId(), tx.getContextId(), tx.getKind(),
                tx.getAmount(), tx.getCurrency(), tx.getOperator());
    }

    public void logTransition(PaymentTransaction tx, TransactionStatus from, StatusSource source) {
        log.info("[AUDIT] PAYMENT_STATUS_CHANGED reference={} from={} to={} source={}",
                tx.getExternalReference(), from, tx.getStatus(), source);
    }

    public void logDuplicateResolution(String reference, TransactionStatus current,
                                       TransactionStatus requested, StatusSource source) {
        log.info("[AUDIT] PAYMENT_DUPLICATE_RESOLUTION reference={} current={} requested={} source={}",
                reference, current, requested, source);
    }

    public void logGatewayRejected(String reference, String gatewayCode, String message) {
        log.warn("[AUDIT] PAYMENT_GATEWAY_REJECTED reference={} code={} message={}", reference, gatewayCode, message);
    }

    public void logAttemptsExhausted(String reference, int attempts) {
        log.warn("[AUDIT] PAYMENT_ATTEMPTS_EXHAUSTED reference={} attempts={}", reference, attempts);
    }

    /** Potential security event: someone posted a notification we could not authenticate. */
    public void logAuthenticationFailure(String claimedReference, String remoteAddress, String reason) {
        log.warn("[AUDIT] [SECURITY] WEBHOOK_AUTHENTICATION_FAILED claimedReference={} remoteAddress={} reason={}",
                claimedReference, remoteAddress, reason);
    }
}
