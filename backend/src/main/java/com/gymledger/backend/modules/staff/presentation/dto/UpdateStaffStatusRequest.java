package com.gymledger.backend.modules.staff.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdateStaffStatusRequest(@NotBlank String status) {
}
