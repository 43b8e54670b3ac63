package com.gymledger.backend.modules.checkin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymledger.backend.modules.checkin.domain.CheckIn;

public record CheckInResponse(
        UUID id,
        UUID memberId,
        OffsetDateTime checkedInAt,
        String admittedBy,
        boolean voided
) {

    public static CheckInResponse from(CheckIn checkIn) {
        return new CheckInResponse(
                checkIn.getId(),
                checkIn.getMember().getId(),
                checkIn.getCheckedInAt(),
                checkIn.getCheckedInBy(),
                checkIn.isDeleted()
        );
    }
}
