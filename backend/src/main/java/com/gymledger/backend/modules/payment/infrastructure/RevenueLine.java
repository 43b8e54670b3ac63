package com.gymledger.backend.modules.payment.infrastructure;

import java.math.BigDecimal;

import com.gymledger.backend.modules.payment.domain.PaymentPurpose;
import com.gymledger.backend.modules.payment.domain.PaymentStatus;

public record RevenueLine(PaymentPurpose purpose, PaymentStatus status, BigDecimal total, Long count) {
}
