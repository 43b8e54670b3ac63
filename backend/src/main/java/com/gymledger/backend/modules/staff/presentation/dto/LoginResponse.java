package com.gymledger.backend.modules.staff.presentation.dto;

import java.time.OffsetDateTime;

public record LoginResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        OffsetDateTime expiresAt,
        StaffResponse staff
) {

    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
