package com.gymledger.backend.modules.staff.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymledger.backend.modules.staff.domain.StaffUser;

public record StaffResponse(
        UUID id,
        UUID gymId,
        String fullName,
        String email,
        String phone,
        String role,
        String status,
        OffsetDateTime deletedAt
) {

    public static StaffResponse from(StaffUser staff) {
        return new StaffResponse(
                staff.getId(),
                staff.getGym().getId(),
                staff.getFullName(),
                staff.getEmail(),
                staff.getPhone(),
                staff.getRole().name(),
                staff.getStatus().name(),
                staff.getDeletedAt()
        );
    }
}
