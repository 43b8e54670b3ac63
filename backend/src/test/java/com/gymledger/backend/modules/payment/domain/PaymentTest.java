package com.gymledger.backend.modules.payment.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import com.gymledger.backend.global.error.InvalidStatusTransitionException;
import com.gymledger.backend.modules.member.domain.MemberStatus;
import com.gymledger.backend.modules.tenant.domain.Gym;
import com.gymledger.backend.support.TestEntities;

import org.junit.jupiter.api.Test;

class PaymentTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 1, 5, 10, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void allowedTransitions() {
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.PAID)).isTrue();
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.CANCELLED)).isTrue();
        assertThat(PaymentStatus.PAID.canTransitionTo(PaymentStatus.REFUNDED)).isTrue();

        assertThat(PaymentStatus.PAID.canTransitionTo(PaymentStatus.PENDING)).isFalse();
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.REFUNDED)).isFalse();
        assertThat(PaymentStatus.REFUNDED.canTransitionTo(PaymentStatus.PAID)).isFalse();
        assertThat(PaymentStatus.CANCELLED.canTransitionTo(PaymentStatus.PAID)).isFalse();
    }

    @Test
    void payingStampsPaidAtAndKeepsAmount() {
        Payment payment = pending();

        payment.transitionTo(PaymentStatus.PAID, NOW);

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(payment.getPaidAt()).isEqualTo(NOW);
        assertThat(payment.getAmount()).isEqualByComparingTo("250000");
    }

    @Test
    void rejectedTransitionLeavesPaymentUntouched() {
        Payment payment = pending();
        payment.transitionTo(PaymentStatus.PAID, NOW);

        assertThatThrownBy(() -> payment.transitionTo(PaymentStatus.PENDING, NOW.plusHours(1)))
                .isInstanceOf(InvalidStatusTransitionException.class);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(payment.getPaidAt()).isEqualTo(NOW);
    }

    @Test
    void recordingAsPaidStampsPaidAtImmediately() {
        Gym gym = TestEntities.gym(UUID.randomUUID());
        Payment payment = Payment.record(gym, TestEntities.member(gym, UUID.randomUUID(), MemberStatus.ACTIVE), null,
                new BigDecimal("50000"), PaymentPurpose.RETAIL, PaymentMethod.CASH, PaymentStatus.PAID, null, NOW);

        assertThat(payment.getPaidAt()).isEqualTo(NOW);
    }

    private Payment pending() {
        Gym gym = TestEntities.gym(UUID.randomUUID());
        return Payment.record(gym, TestEntities.member(gym, UUID.randomUUID(), MemberStatus.ACTIVE), null,
                new BigDecimal("250000"), PaymentPurpose.MEMBERSHIP, PaymentMethod.CASH, PaymentStatus.PENDING, null, NOW);
    }
}
