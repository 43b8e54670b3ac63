package com.gymledger.backend.modules.payment.domain;

public enum PaymentStatus {
    PENDING,
    PAID,
    REFUNDED,
    CANCELLED;

    public boolean canTransitionTo(PaymentStatus target) {
        return switch (this) {
            case PENDING -> target == PAID || target == CANCELLED;
            case PAID -> target == REFUNDED;
            case REFUNDED, CANCELLED -> false;
        };
    }
}
