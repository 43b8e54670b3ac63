package com.gymledger.backend.modules.tenant.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import com.gymledger.backend.modules.staff.presentation.dto.CreateStaffRequest;

public record OnboardGymRequest(
        @NotBlank @Size(max = 150) String name,
        @Size(max = 255) String address,
        @Size(max = 20) String phone,
        @NotNull @Valid CreateStaffRequest owner
) {
}
