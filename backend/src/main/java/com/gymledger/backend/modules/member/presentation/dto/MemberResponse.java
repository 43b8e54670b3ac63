package com.gymledger.backend.modules.member.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymledger.backend.modules.member.domain.Member;

public record MemberResponse(
        UUID id,
        String memberCode,
        String fullName,
        String phone,
        String email,
        String gender,
        LocalDate dateOfBirth,
        String status,
        OffsetDateTime createdAt,
        OffsetDateTime deletedAt
) {

    public static MemberResponse from(Member member) {
        return new MemberResponse(
                member.getId(),
                member.getMemberCode(),
                member.getFullName(),
                member.getPhone(),
                member.getEmail(),
                member.getGender().name(),
                member.getDateOfBirth(),
                member.getStatus().name(),
                member.getCreatedAt(),
                member.getDeletedAt()
        );
    }
}
