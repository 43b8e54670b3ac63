package com.gymledger.backend.modules.payment.domain;

public enum PaymentPurpose {
    MEMBERSHIP,
    CLASS,
    RETAIL
}
