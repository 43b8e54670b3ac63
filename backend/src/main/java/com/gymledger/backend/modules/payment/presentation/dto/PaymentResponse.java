package com.gymledger.backend.modules.payment.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymledger.backend.modules.payment.domain.Payment;

public record PaymentResponse(
        UUID id,
        UUID memberId,
        UUID membershipId,
        BigDecimal amount,
        String paymentFor,
        String method,
        String status,
        OffsetDateTime paidAt,
        String notes,
        OffsetDateTime createdAt
) {

    public static PaymentResponse from(Payment payment) {
        return new PaymentResponse(
                payment.getId(),
                payment.getMember().getId(),
                payment.getMembership() != null ? payment.getMembership().getId() : null,
                payment.getAmount(),
                payment.getPurpose().name(),
                payment.getMethod().name(),
                payment.getStatus().name(),
                payment.getPaidAt(),
                payment.getNotes(),
                payment.getCreatedAt()
        );
    }
}
