package com.gymledger.backend.modules.tenant.presentation.dto;

import com.gymledger.backend.modules.staff.presentation.dto.StaffResponse;

public record OnboardGymResponse(GymResponse gym, StaffResponse owner) {
}
