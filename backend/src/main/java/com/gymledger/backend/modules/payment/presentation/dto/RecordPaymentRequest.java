package com.gymledger.backend.modules.payment.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RecordPaymentRequest(
        @NotNull UUID memberId,
        UUID membershipId,
        @NotNull @Digits(integer = 10, fraction = 2) BigDecimal amount,
        @NotBlank String paymentFor,
        @NotBlank String method,
        @NotBlank String status,
        String notes
) {
}
