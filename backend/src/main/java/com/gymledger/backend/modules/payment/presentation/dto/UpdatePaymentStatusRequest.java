package com.gymledger.backend.modules.payment.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdatePaymentStatusRequest(@NotBlank String status) {
}
