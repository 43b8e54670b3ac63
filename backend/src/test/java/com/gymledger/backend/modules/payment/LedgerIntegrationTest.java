package com.gymledger.backend.modules.payment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.gymledger.backend.global.error.BusinessRuleViolationException;
import com.gymledger.backend.global.error.InvalidEnumValueException;
import com.gymledger.backend.global.error.InvalidStatusTransitionException;
import com.gymledger.backend.global.error.ProblemException;
import com.gymledger.backend.modules.member.application.MemberService;
import com.gymledger.backend.modules.member.domain.Member;
import com.gymledger.backend.modules.membership.application.MembershipService;
import com.gymledger.backend.modules.membership.application.MembershipService.AssignmentCommand;
import com.gymledger.backend.modules.membership.domain.Membership;
import com.gymledger.backend.modules.payment.application.LedgerService;
import com.gymledger.backend.modules.payment.application.LedgerService.PaymentCommand;
import com.gymledger.backend.modules.payment.domain.Payment;
import com.gymledger.backend.modules.payment.domain.PaymentStatus;
import com.gymledger.backend.modules.plan.domain.MembershipPlan;
import com.gymledger.backend.support.AbstractPostgresIntegrationTest;
import com.gymledger.backend.support.TestTenantFactory;
import com.gymledger.backend.support.TestTenantFactory.Tenant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class LedgerIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private TestTenantFactory tenantFactory;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private MemberService memberService;

    @Autowired
    private MembershipService membershipService;

    private Tenant tenant;
    private Member member;
    private Membership membership;

    @BeforeEach
    void setUp() {
        tenant = tenantFactory.createTenant("Nyx Gym");
        MembershipPlan monthly = tenantFactory.createPlan(tenant, "Monthly", 30, "250000");
        member = tenantFactory.createMember(tenant, "Budi Santoso", "+6281111111111");
        membership = membershipService.assign(tenant.gymId(), tenant.staffId(),
                new AssignmentCommand(member.getId(), monthly.getId(), LocalDate.of(2026, 1, 1), false, false));
    }

    @Test
    @DisplayName("a settled payment cannot go back to pending and keeps its amount")
    void paidPaymentIsFinalForPending() {
        Payment payment = ledgerService.recordPayment(tenant.gymId(), tenant.staffId(),
                command("250000", "PENDING"));
        assertThat(payment.getPaidAt()).isNull();

        Payment paid = ledgerService.transitionStatus(tenant.gymId(), tenant.staffId(), payment.getId(), "PAID");
        assertThat(paid.getStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(paid.getPaidAt()).isNotNull();

        assertThatThrownBy(() -> ledgerService.transitionStatus(tenant.gymId(), tenant.staffId(), payment.getId(), "PENDING"))
                .isInstanceOf(InvalidStatusTransitionException.class);

        Payment reloaded = ledgerService.getPayment(tenant.gymId(), payment.getId());
        assertThat(reloaded.getStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(reloaded.getAmount()).isEqualByComparingTo(new BigDecimal("250000"));
    }

    @Test
    void refundFollowsPaid() {
        Payment payment = ledgerService.recordPayment(tenant.gymId(), tenant.staffId(), command("250000", "PAID"));

        Payment refunded = ledgerService.transitionStatus(tenant.gymId(), tenant.staffId(), payment.getId(), "refunded");

        assertThat(refunded.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThatThrownBy(() -> ledgerService.transitionStatus(tenant.gymId(), tenant.staffId(), payment.getId(), "PAID"))
                .isInstanceOf(InvalidStatusTransitionException.class);
    }

    @Test
    void negativeAmountIsRejected() {
        assertThatThrownBy(() -> ledgerService.recordPayment(tenant.gymId(), tenant.staffId(), command("-1", "PAID")))
                .isInstanceOfSatisfying(BusinessRuleViolationException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_AMOUNT"));
    }

    @Test
    void zeroAmountIsAccepted() {
        Payment complimentary = ledgerService.recordPayment(tenant.gymId(), tenant.staffId(), command("0", "PAID"));
        assertThat(complimentary.getAmount()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void unknownMethodIsRejected() {
        PaymentCommand command = new PaymentCommand(member.getId(), null, new BigDecimal("50000"),
                "RETAIL", "CHEQUE", "PAID", null);

        assertThatThrownBy(() -> ledgerService.recordPayment(tenant.gymId(), tenant.staffId(), command))
                .isInstanceOf(InvalidEnumValueException.class);
    }

    @Test
    void membershipOfAnotherMemberIsRejected() {
        Member other = tenantFactory.createMember(tenant, "Citra Lestari", "+6282222222222");
        PaymentCommand command = new PaymentCommand(other.getId(), membership.getId(), new BigDecimal("250000"),
                "MEMBERSHIP", "CASH", "PAID", null);

        assertThatThrownBy(() -> ledgerService.recordPayment(tenant.gymId(), tenant.staffId(), command))
                .isInstanceOfSatisfying(BusinessRuleViolationException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("MEMBERSHIP_MEMBER_MISMATCH"));
    }

    @Test
    void pendingPaymentBlocksMemberDeletion() {
        membershipService.cancel(tenant.gymId(), tenant.staffId(), membership.getId());
        Payment pending = ledgerService.recordPayment(tenant.gymId(), tenant.staffId(), command("250000", "PENDING"));

        assertThatThrownBy(() -> memberService.softDelete(tenant.gymId(), tenant.staffId(), member.getId()))
                .isInstanceOfSatisfying(BusinessRuleViolationException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("MEMBER_HAS_PENDING_PAYMENTS");
                    assertThat(ex.getContext().get("pendingPaymentIds")).isEqualTo(List.of(pending.getId()));
                });

        ledgerService.transitionStatus(tenant.gymId(), tenant.staffId(), pending.getId(), "CANCELLED");
        memberService.softDelete(tenant.gymId(), tenant.staffId(), member.getId());
    }

    @Test
    void deletedMembersStayInTheLedgerButTakeNoNewPayments() {
        ledgerService.recordPayment(tenant.gymId(), tenant.staffId(), command("250000", "PAID"));
        membershipService.cancel(tenant.gymId(), tenant.staffId(), membership.getId());
        memberService.softDelete(tenant.gymId(), tenant.staffId(), member.getId());

        assertThat(ledgerService.listPayments(tenant.gymId(), member.getId())).hasSize(1);
        assertThat(ledgerService.listPayments(tenant.gymId(), null)).hasSize(1);
        assertThatThrownBy(() -> ledgerService.recordPayment(tenant.gymId(), tenant.staffId(), command("1000", "PAID")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("MEMBER_NOT_FOUND"));
    }

    private PaymentCommand command(String amount, String status) {
        return new PaymentCommand(member.getId(), membership.getId(), new BigDecimal(amount),
                "MEMBERSHIP", "CASH", status, null);
    }
}
