package com.gymledger.backend.modules.membership.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.gymledger.backend.global.error.BusinessRuleViolationException;
import com.gymledger.backend.global.error.InvalidStatusTransitionException;
import com.gymledger.backend.global.error.ProblemException;
import com.gymledger.backend.global.tenant.TenantGuard;
import com.gymledger.backend.modules.audit.application.AuditLogService;
import com.gymledger.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.gymledger.backend.modules.member.domain.Member;
import com.gymledger.backend.modules.member.domain.MemberStatus;
import com.gymledger.backend.modules.member.infrastructure.MemberRepository;
import com.gymledger.backend.modules.membership.domain.GymAccessDecision;
import com.gymledger.backend.modules.membership.domain.Membership;
import com.gymledger.backend.modules.membership.domain.MembershipStatus;
import com.gymledger.backend.modules.membership.infrastructure.MembershipRepository;
import com.gymledger.backend.modules.plan.domain.MembershipPlan;
import com.gymledger.backend.modules.plan.infrastructure.MembershipPlanRepository;
import com.gymledger.backend.modules.staff.application.StaffService;
import com.gymledger.backend.modules.staff.domain.StaffUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Membership lifecycle. Every time-dependent decision takes an explicit
 * {@code asOf}; the clock is only read to stamp cancellations.
 */
@Service
public class MembershipService {

    private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

    private final MembershipRepository membershipRepository;
    private final MemberRepository memberRepository;
    private final MembershipPlanRepository planRepository;
    private final StaffService staffService;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final int renewalWindowDays;

    public MembershipService(
            MembershipRepository membershipRepository,
            MemberRepository memberRepository,
            MembershipPlanRepository planRepository,
            StaffService staffService,
            AuditLogService auditLogService,
            Clock clock,
            @Value("${gymledger.membership.renewal-window-days:7}") int renewalWindowDays
    ) {
        this.membershipRepository = membershipRepository;
        this.memberRepository = memberRepository;
        this.planRepository = planRepository;
        this.staffService = staffService;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.renewalWindowDays = renewalWindowDays;
    }

    @Transactional
    public Membership assign(UUID gymId, UUID staffId, AssignmentCommand command) {
        StaffUser actor = staffService.requireActingStaff(gymId, staffId);
        if (command.startDate() == null) {
            throw new BusinessRuleViolationException("START_DATE_REQUIRED", "A start date is required");
        }

        // same row lock as member deletion, so the two cannot interleave
        Member member = memberRepository.findByIdForUpdate(command.memberId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, member.getGym().getId(), "Member");
        if (member.isDeleted()) {
            throw new BusinessRuleViolationException("MEMBER_NOT_ELIGIBLE", "Deleted members cannot receive memberships");
        }
        if (member.getStatus() == MemberStatus.INACTIVE && !command.overrideInactive()) {
            throw new BusinessRuleViolationException("MEMBER_INACTIVE", "Member is inactive; confirm the override to assign");
        }

        MembershipPlan plan = planRepository.findById(command.planId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PLAN_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, plan.getGym().getId(), "Membership plan");
        if (!plan.isAssignable()) {
            throw new BusinessRuleViolationException("PLAN_INACTIVE", "Plan is not available for new memberships");
        }

        Membership membership = membershipRepository.save(
                Membership.assign(member.getGym(), member, plan, command.startDate(), command.autoRenew()));

        Map<String, Object> detail = new HashMap<>();
        detail.put("memberId", member.getId().toString());
        detail.put("planId", plan.getId().toString());
        detail.put("startDate", membership.getStartDate().toString());
        detail.put("endDate", membership.getEndDate().toString());
        record(gymId, AuditLogService.MEMBERSHIP_ASSIGNED, membership, actor.getId(), detail);
        return membership;
    }

    @Transactional
    public Membership cancel(UUID gymId, UUID staffId, UUID membershipId) {
        StaffUser actor = staffService.requireActingStaff(gymId, staffId);
        Membership membership = lockMembership(gymId, membershipId);
        MembershipStatus previous = membership.getStatus();
        membership.cancel(OffsetDateTime.now(clock));
        record(gymId, AuditLogService.MEMBERSHIP_CANCELLED, membership, actor.getId(), Map.of("from", previous.name()));
        return membership;
    }

    /**
     * Staff-initiated renewal. The successor starts the day after the current
     * period, or on {@code asOf} when the current period has already lapsed.
     */
    @Transactional
    public Membership renew(UUID gymId, UUID staffId, UUID membershipId, LocalDate asOf) {
        StaffUser actor = staffService.requireActingStaff(gymId, staffId);
        Membership membership = lockMembership(gymId, membershipId);
        if (membership.getStatus().isTerminal()) {
            throw new InvalidStatusTransitionException(Membership.RESOURCE_TYPE, membership.getStatus(), MembershipStatus.ACTIVE);
        }
        if (membership.isRenewed()) {
            throw new BusinessRuleViolationException("MEMBERSHIP_ALREADY_RENEWED", "Membership already has a successor",
                    Map.of("successorId", membership.getRenewedBy().getId()));
        }
        if (membership.getMember().isDeleted()) {
            throw new BusinessRuleViolationException("MEMBER_NOT_ELIGIBLE", "Deleted members cannot renew");
        }
        if (!membership.getPlan().isAssignable()) {
            throw new BusinessRuleViolationException("PLAN_INACTIVE", "Plan is not available for new memberships");
        }

        Membership successor = createSuccessor(membership, membership.nextPeriodStart(asOf));
        record(gymId, AuditLogService.MEMBERSHIP_RENEWED, membership, actor.getId(), Map.of(
                "successorId", successor.getId().toString(),
                "auto", false
        ));
        return successor;
    }

    /**
     * Brings every live, non-terminal membership of the gym in line with
     * {@code asOf}. Running it twice for the same date changes nothing the
     * second time.
     */
    @Transactional
    public SweepResult recomputeStatuses(UUID gymId, LocalDate asOf) {
        List<Membership> candidates = membershipRepository.findSweepCandidatesForUpdate(
                gymId, MembershipStatus.accessGranting());
        Deque<Membership> queue = new ArrayDeque<>(candidates);

        int transitioned = 0;
        int expired = 0;
        int pendingRenewal = 0;
        int autoRenewed = 0;

        while (!queue.isEmpty()) {
            Membership membership = queue.poll();
            MembershipStatus target = membership.evaluate(asOf, renewalWindowDays);

            if (target == MembershipStatus.EXPIRED && membership.isAutoRenew() && !membership.isRenewed()) {
                if (isEligibleForAutoRenew(membership)) {
                    Membership successor = createSuccessor(membership, membership.getEndDate().plusDays(1));
                    record(gymId, AuditLogService.MEMBERSHIP_RENEWED, membership, null, Map.of(
                            "successorId", successor.getId().toString(),
                            "auto", true
                    ));
                    autoRenewed++;
                    // the successor may itself be due already
                    queue.add(successor);
                } else {
                    log.warn("Auto-renewal skipped for membership={} gym={}: member or plan not eligible",
                            membership.getId(), gymId);
                }
            }

            if (target != membership.getStatus()) {
                membership.transitionTo(target);
                transitioned++;
                if (target == MembershipStatus.EXPIRED) {
                    expired++;
                } else if (target == MembershipStatus.PENDING_RENEWAL) {
                    pendingRenewal++;
                }
            }
        }

        log.info("Status sweep gym={} asOf={} transitioned={} expired={} pendingRenewal={} autoRenewed={}",
                gymId, asOf, transitioned, expired, pendingRenewal, autoRenewed);
        return new SweepResult(transitioned, expired, pendingRenewal, autoRenewed);
    }

    @Transactional
    public boolean hasGymAccess(UUID gymId, UUID memberId, OffsetDateTime asOf) {
        return decideAccess(gymId, memberId, asOf).granted();
    }

    /**
     * Candidate memberships are read under a shared lock so a concurrent sweep
     * cannot expire them halfway through the decision.
     */
    @Transactional
    public AccessCheck decideAccess(UUID gymId, UUID memberId, OffsetDateTime asOf) {
        Member member = memberRepository.findById(memberId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, member.getGym().getId(), "Member");

        if (member.isDeleted()) {
            return new AccessCheck(GymAccessDecision.MEMBER_DELETED, member, null);
        }
        if (member.getStatus() != MemberStatus.ACTIVE) {
            return new AccessCheck(GymAccessDecision.MEMBER_INACTIVE, member, null);
        }

        LocalDate asOfDate = asOf.toLocalDate();
        return membershipRepository.findAccessCandidatesForShare(gymId, memberId, MembershipStatus.accessGranting())
                .stream()
                .filter(candidate -> candidate.covers(asOfDate))
                .max(Comparator.comparing(Membership::getEndDate))
                .map(covering -> new AccessCheck(GymAccessDecision.GRANTED, member, covering))
                .orElseGet(() -> new AccessCheck(GymAccessDecision.NO_ACTIVE_MEMBERSHIP, member, null));
    }

    @Transactional(readOnly = true)
    public Membership getMembership(UUID gymId, UUID membershipId) {
        Membership membership = membershipRepository.findById(membershipId)
                .filter(candidate -> !candidate.isDeleted())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBERSHIP_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, membership.getGym().getId(), Membership.RESOURCE_TYPE);
        return membership;
    }

    @Transactional(readOnly = true)
    public List<Membership> listMemberships(UUID gymId, UUID memberId) {
        Member member = memberRepository.findById(memberId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, member.getGym().getId(), "Member");
        return membershipRepository.findByMember(gymId, memberId);
    }

    private Membership lockMembership(UUID gymId, UUID membershipId) {
        Membership membership = membershipRepository.findByIdForUpdate(membershipId)
                .filter(candidate -> !candidate.isDeleted())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBERSHIP_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, membership.getGym().getId(), Membership.RESOURCE_TYPE);
        return membership;
    }

    private boolean isEligibleForAutoRenew(Membership membership) {
        return membership.getMember().isActiveAndLive() && membership.getPlan().isAssignable();
    }

    private Membership createSuccessor(Membership current, LocalDate start) {
        // a fresh assignment: the plan's current duration applies to the new period only
        Membership successor = membershipRepository.save(Membership.assign(
                current.getGym(),
                current.getMember(),
                current.getPlan(),
                start,
                current.isAutoRenew()
        ));
        current.markRenewedBy(successor);
        return successor;
    }

    private void record(UUID gymId, String action, Membership membership, UUID actorStaffId, Map<String, Object> detail) {
        auditLogService.record(new AuditLogCommand(
                gymId,
                action,
                Membership.RESOURCE_TYPE,
                membership.getId().toString(),
                actorStaffId,
                detail
        ));
    }

    public record AssignmentCommand(
            UUID memberId,
            UUID planId,
            LocalDate startDate,
            boolean autoRenew,
            boolean overrideInactive
    ) {
    }
}
