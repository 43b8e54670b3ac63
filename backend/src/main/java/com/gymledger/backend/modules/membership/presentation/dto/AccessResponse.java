package com.gymledger.backend.modules.membership.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymledger.backend.modules.membership.application.AccessCheck;

public record AccessResponse(
        UUID memberId,
        boolean hasAccess,
        String decision,
        UUID membershipId,
        OffsetDateTime asOf
) {

    public static AccessResponse from(UUID memberId, AccessCheck check, OffsetDateTime asOf) {
        return new AccessResponse(
                memberId,
                check.granted(),
                check.decision().name(),
                check.membership() != null ? check.membership().getId() : null,
                asOf
        );
    }
}
