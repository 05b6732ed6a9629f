package com.payment.lifecycle.api;

import com.payment.lifecycle.domain.PaymentKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Request body for {@code POST /payments/initiate}. Amount sign is checked by the ledger
 * so that a non-positive amount is reported as {@code INVALID_AMOUNT}.
 */
@Data
public class InitiatePaymentRequestDto {

    @NotNull
    private Long payerId;

    /** Training session (or other billing context) being paid for. */
    @NotNull
    private Long contextId;

    /** Minor currency units. */
    @NotNull
    private Long amount;

    @NotBlank
    @Size(min = 3, max = 3)
    private String currency;

    @NotNull
    private PaymentKind kind;

    @Size(max = 255)
    private String description;
}
