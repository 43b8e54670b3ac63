package com.gymledger.backend.modules.membership.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymledger.backend.modules.membership.domain.Membership;

public record MembershipResponse(
        UUID id,
        UUID memberId,
        UUID planId,
        LocalDate startDate,
        LocalDate endDate,
        String status,
        boolean autoRenew,
        OffsetDateTime cancelledAt,
        UUID renewedById
) {

    public static MembershipResponse from(Membership membership) {
        return new MembershipResponse(
                membership.getId(),
                membership.getMember().getId(),
                membership.getPlan().getId(),
                membership.getStartDate(),
                membership.getEndDate(),
                membership.getStatus().name(),
                membership.isAutoRenew(),
                membership.getCancelledAt(),
                membership.getRenewedBy() != null ? membership.getRenewedBy().getId() : null
        );
    }
}
