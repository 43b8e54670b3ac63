package com.gymledger.backend.modules.member.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;

public record UpdateMemberRequest(
        @Size(max = 150) String fullName,
        @Size(max = 20) String phone,
        @Email @Size(max = 320) String email,
        String gender,
        @Past LocalDate dateOfBirth,
        String status
) {
}
