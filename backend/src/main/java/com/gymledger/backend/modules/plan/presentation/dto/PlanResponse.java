package com.gymledger.backend.modules.plan.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import com.gymledger.backend.modules.plan.domain.MembershipPlan;

public record PlanResponse(
        UUID id,
        String name,
        int durationDays,
        BigDecimal price,
        boolean active,
        String description
) {

    public static PlanResponse from(MembershipPlan plan) {
        return new PlanResponse(
                plan.getId(),
                plan.getName(),
                plan.getDurationDays(),
                plan.getPrice(),
                plan.isActive(),
                plan.getDescription()
        );
    }
}
