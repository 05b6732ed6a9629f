package com.payment.lifecycle.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps lifecycle errors to HTTP statuses and a {@code {error, message}} JSON body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        e -> e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid",
                        (first, second) -> first));
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "message", "Request validation failed", "details", errors));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, String>> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return ResponseEntity
                .status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(Map.of("error", "VALIDATION_FAILED", "message", getMessageOrCause(ex)));
    }

    /** Detail stays in the server log; the untrusted caller only learns that authentication failed. */
    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<Map<String, String>> handleAuthentication(AuthenticationFailedException ex) {
        log.warn("Rejected unauthenticated notification: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", ex.getErrorKind(), "message", "Notification could not be authenticated"));
    }

    @ExceptionHandler(GatewayUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleGatewayUnavailable(GatewayUnavailableException ex) {
        Map<String, String> body = new HashMap<>();
        body.put("error", ex.getErrorKind());
        body.put("message", "Payment gateway temporarily unavailable; the payment will be checked again automatically");
        if (ex.getExternalReference() != null) {
            body.put("externalReference", ex.getExternalReference());
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(GatewayRejectedException.class)
    public ResponseEntity<Map<String, String>> handleGatewayRejected(GatewayRejectedException ex) {
        Map<String, String> body = new HashMap<>();
        body.put("error", ex.getErrorKind());
        body.put("message", getMessageOrCause(ex));
        if (ex.getExternalReference() != null) {
            body.put("externalReference", ex.getExternalReference());
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(PaymentLifecycleException.class)
    public ResponseEntity<Map<String, String>> handleLifecycle(PaymentLifecycleException ex) {
        HttpStatus status = statusFor(ex.getErrorKind());
        log.debug("Lifecycle error: kind={}, status={}, message={}", ex.getErrorKind(), status.value(), ex.getMessage());
        return ResponseEntity
                .status(status)
                .body(Map.of("error", ex.getErrorKind(), "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", getMessageOrCause(ex)));
    }

    static HttpStatus statusFor(String errorKind) {
        switch (errorKind) {
            case "INVALID_AMOUNT":
            case "UNSUPPORTED_CURRENCY":
            case "AUTHENTICATION_FAILED":
            case "MALFORMED_NOTIFICATION":
                return HttpStatus.BAD_REQUEST;
            case "DUPLICATE_REFERENCE":
                return HttpStatus.CONFLICT;
            case "NOT_FOUND":
                return HttpStatus.NOT_FOUND;
            case "GATEWAY_REJECTED":
                return HttpStatus.BAD_GATEWAY;
            case "GATEWAY_UNAVAILABLE":
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
