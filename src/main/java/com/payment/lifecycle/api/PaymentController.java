package com.payment.lifecycle.api;

import com.payment.lifecycle.core.PaymentInitiationService;
import com.payment.lifecycle.domain.PaymentTransaction;
import com.payment.lifecycle.ledger.PaymentIntent;
import com.payment.lifecycle.ledger.TransactionLedger;
import com.payment.lifecycle.worker.ReconciliationWorker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for creating payments and reading their status.
 */
@Slf4j
@RestController
@RequestMapping("/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Initiate payments and query their lifecycle")
public class PaymentController {

    private final PaymentInitiationService initiationService;
    private final TransactionLedger ledger;
    private final ReconciliationWorker reconciliationWorker;

    @PostMapping("/initiate")
    @Operation(
            summary = "Initiate payment",
            description = "Creates a PENDING transaction, opens a hosted payment page at the gateway and returns its URL. "
                    + "The final status arrives later through the gateway notification or the reconciliation worker.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Transaction created and payment page opened.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = InitiatePaymentResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "INVALID_AMOUNT, UNSUPPORTED_CURRENCY or VALIDATION_FAILED."),
            @ApiResponse(responseCode = "409", description = "DUPLICATE_REFERENCE: retry the request."),
            @ApiResponse(responseCode = "502", description = "GATEWAY_REJECTED: the transaction was created and marked FAILED."),
            @ApiResponse(responseCode = "503", description = "GATEWAY_UNAVAILABLE: the transaction stays PENDING and will be reconciled.")
    })
    public ResponseEntity<InitiatePaymentResponseDto> initiate(@Valid @RequestBody InitiatePaymentRequestDto dto) {
        PaymentIntent intent = PaymentIntent.builder()
                .payerId(dto.getPayerId())
                .contextId(dto.getContextId())
                .amount(dto.getAmount())
                .currency(dto.getCurrency())
                .kind(dto.getKind())
                .description(dto.getDescription())
                .build();
        PaymentTransaction tx = initiationService.initiate(intent);
        return ResponseEntity.status(HttpStatus.CREATED).body(InitiatePaymentResponseDto.from(tx));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get payment by id")
    public PaymentResponseDto getById(@PathVariable Long id) {
        return PaymentResponseDto.from(ledger.get(id));
    }

    @GetMapping("/reference/{externalReference}")
    @Operation(summary = "Get payment by external reference")
    public PaymentResponseDto getByReference(@PathVariable String externalReference) {
        return PaymentResponseDto.from(ledger.getByReference(externalReference));
    }

    @GetMapping("/reference/{externalReference}/history")
    @Operation(summary = "Status history of a payment", description = "One row per effective status write, oldest first.")
    public List<StatusHistoryDto> history(@PathVariable String externalReference) {
        ledger.getByReference(externalReference);
        return ledger.history(externalReference).stream()
                .map(StatusHistoryDto::from)
                .collect(Collectors.toList());
    }

    @PostMapping("/reference/{externalReference}/verify")
    @Operation(summary = "Verify payment now",
            description = "Asks the gateway for the current status and applies it. Does not consume a reconciliation attempt.")
    public PaymentResponseDto verify(@PathVariable String externalReference) {
        return PaymentResponseDto.from(reconciliationWorker.verifyNow(externalReference));
    }

    @GetMapping("/payer/{payerId}")
    @Operation(summary = "List a payer's payments", description = "Newest first.")
    public List<PaymentResponseDto> listByPayer(@PathVariable Long payerId) {
        return ledger.listByPayer(payerId).stream()
                .map(PaymentResponseDto::from)
                .collect(Collectors.toList());
    }

    @PostMapping(value = "/return", consumes = {MediaType.APPLICATION_FORM_URLENCODED_VALUE, MediaType.MULTIPART_FORM_DATA_VALUE})
    @Operation(summary = "Payer return", description = "Landing call when the payer comes back from the gateway page.")
    public PaymentReturnResponseDto paymentReturn(@RequestParam(name = "transaction_id", required = false) String transactionId) {
        if (transactionId == null || transactionId.isBlank()) {
            throw new IllegalArgumentException("transaction_id is required");
        }
        log.info("Payer returned from gateway: reference={}", transactionId);
        return PaymentReturnResponseDto.from(ledger.getByReference(transactionId));
    }
}
