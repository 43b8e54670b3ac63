package com.gymledger.backend.modules.payment.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.gymledger.backend.global.error.BusinessRuleViolationException;
import com.gymledger.backend.global.error.InvalidEnumValueException;
import com.gymledger.backend.global.error.ProblemException;
import com.gymledger.backend.global.tenant.TenantGuard;
import com.gymledger.backend.modules.audit.application.AuditLogService;
import com.gymledger.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.gymledger.backend.modules.member.domain.Member;
import com.gymledger.backend.modules.member.infrastructure.MemberRepository;
import com.gymledger.backend.modules.membership.domain.Membership;
import com.gymledger.backend.modules.membership.infrastructure.MembershipRepository;
import com.gymledger.backend.modules.payment.domain.Payment;
import com.gymledger.backend.modules.payment.domain.PaymentMethod;
import com.gymledger.backend.modules.payment.domain.PaymentPurpose;
import com.gymledger.backend.modules.payment.domain.PaymentStatus;
import com.gymledger.backend.modules.payment.infrastructure.PaymentRepository;
import com.gymledger.backend.modules.staff.application.StaffService;
import com.gymledger.backend.modules.staff.domain.StaffUser;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Payment ledger. Amounts are written once; only the status moves afterwards.
 */
@Service
public class LedgerService {

    private final PaymentRepository paymentRepository;
    private final MemberRepository memberRepository;
    private final MembershipRepository membershipRepository;
    private final StaffService staffService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public LedgerService(
            PaymentRepository paymentRepository,
            MemberRepository memberRepository,
            MembershipRepository membershipRepository,
            StaffService staffService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.paymentRepository = paymentRepository;
        this.memberRepository = memberRepository;
        this.membershipRepository = membershipRepository;
        this.staffService = staffService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional
    public Payment recordPayment(UUID gymId, UUID staffId, PaymentCommand command) {
        StaffUser actor = staffService.requireActingStaff(gymId, staffId);

        BigDecimal amount = command.amount();
        if (amount == null || amount.signum() < 0) {
            throw new BusinessRuleViolationException("INVALID_AMOUNT", "Amount must be zero or more");
        }
        PaymentPurpose purpose = InvalidEnumValueException.parse(PaymentPurpose.class, "paymentFor", command.purpose());
        PaymentMethod method = InvalidEnumValueException.parse(PaymentMethod.class, "method", command.method());
        PaymentStatus status = InvalidEnumValueException.parse(PaymentStatus.class, "status", command.status());

        Member member = memberRepository.findById(command.memberId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, member.getGym().getId(), "Member");
        if (member.isDeleted()) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND");
        }

        Membership membership = null;
        if (command.membershipId() != null) {
            membership = membershipRepository.findById(command.membershipId())
                    .filter(candidate -> !candidate.isDeleted())
                    .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBERSHIP_NOT_FOUND"));
            TenantGuard.requireSameTenant(gymId, membership.getGym().getId(), Membership.RESOURCE_TYPE);
            if (!membership.getMember().getId().equals(member.getId())) {
                throw new BusinessRuleViolationException("MEMBERSHIP_MEMBER_MISMATCH",
                        "Membership belongs to a different member");
            }
        }

        Payment payment = paymentRepository.save(Payment.record(
                member.getGym(),
                member,
                membership,
                amount,
                purpose,
                method,
                status,
                command.notes(),
                OffsetDateTime.now(clock)
        ));

        Map<String, Object> detail = new HashMap<>();
        detail.put("memberId", member.getId().toString());
        detail.put("amount", amount.toPlainString());
        detail.put("status", status.name());
        auditLogService.record(new AuditLogCommand(
                gymId,
                AuditLogService.PAYMENT_RECORDED,
                Payment.RESOURCE_TYPE,
                payment.getId().toString(),
                actor.getId(),
                detail
        ));
        return payment;
    }

    @Transactional
    public Payment transitionStatus(UUID gymId, UUID staffId, UUID paymentId, String newStatus) {
        StaffUser actor = staffService.requireActingStaff(gymId, staffId);
        PaymentStatus target = InvalidEnumValueException.parse(PaymentStatus.class, "status", newStatus);

        Payment payment = paymentRepository.findByIdForUpdate(paymentId)
                .filter(candidate -> !candidate.isDeleted())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PAYMENT_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, payment.getGym().getId(), Payment.RESOURCE_TYPE);

        PaymentStatus previous = payment.getStatus();
        payment.transitionTo(target, OffsetDateTime.now(clock));
        auditLogService.record(new AuditLogCommand(
                gymId,
                AuditLogService.PAYMENT_STATUS_CHANGED,
                Payment.RESOURCE_TYPE,
                payment.getId().toString(),
                actor.getId(),
                Map.of("from", previous.name(), "to", target.name())
        ));
        return payment;
    }

    @Transactional(readOnly = true)
    public Payment getPayment(UUID gymId, UUID paymentId) {
        Payment payment = paymentRepository.findById(paymentId)
                .filter(candidate -> !candidate.isDeleted())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PAYMENT_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, payment.getGym().getId(), Payment.RESOURCE_TYPE);
        return payment;
    }

    /**
     * Payments of deleted members are listed too.
     */
    @Transactional(readOnly = true)
    public List<Payment> listPayments(UUID gymId, UUID memberId) {
        if (memberId == null) {
            return paymentRepository.findLedger(gymId);
        }
        Member member = memberRepository.findById(memberId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, member.getGym().getId(), "Member");
        return paymentRepository.findLedgerByMember(gymId, memberId);
    }

    public record PaymentCommand(
            UUID memberId,
            UUID membershipId,
            BigDecimal amount,
            String purpose,
            String method,
            String status,
            String notes
    ) {
    }
}
