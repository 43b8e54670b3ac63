package com.gymledger.backend.modules.plan.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record UpdatePlanRequest(
        @Size(max = 120) String name,
        @Positive Integer durationDays,
        @DecimalMin("0.00") @Digits(integer = 10, fraction = 2) BigDecimal price,
        String description
) {
}
