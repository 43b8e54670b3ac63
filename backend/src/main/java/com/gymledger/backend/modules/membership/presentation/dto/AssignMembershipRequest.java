package com.gymledger.backend.modules.membership.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record AssignMembershipRequest(
        @NotNull UUID memberId,
        @NotNull UUID planId,
        @NotNull LocalDate startDate,
        boolean autoRenew,
        boolean overrideInactive
) {
}
