package com.gymledger.backend.modules.checkin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CheckInRequest(
        @NotNull UUID memberId,
        @NotBlank @Size(max = 120) String admittedBy,
        OffsetDateTime asOf
) {
}
