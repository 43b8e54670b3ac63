package com.gymledger.backend.modules.checkin.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.gymledger.backend.global.error.BusinessRuleViolationException;
import com.gymledger.backend.global.error.ProblemException;
import com.gymledger.backend.global.tenant.TenantGuard;
import com.gymledger.backend.modules.audit.application.AuditLogService;
import com.gymledger.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.gymledger.backend.modules.checkin.domain.CheckIn;
import com.gymledger.backend.modules.checkin.infrastructure.CheckInRepository;
import com.gymledger.backend.modules.member.domain.Member;
import com.gymledger.backend.modules.member.infrastructure.MemberRepository;
import com.gymledger.backend.modules.membership.application.AccessCheck;
import com.gymledger.backend.modules.membership.application.MembershipService;
import com.gymledger.backend.modules.staff.application.StaffService;
import com.gymledger.backend.modules.staff.domain.StaffUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CheckInService {

    private static final Logger log = LoggerFactory.getLogger(CheckInService.class);
    private static final String RESOURCE_TYPE = "CheckIn";
    private static final int ADMITTED_BY_MAX_LENGTH = 120;

    private final CheckInRepository checkInRepository;
    private final MemberRepository memberRepository;
    private final MembershipService membershipService;
    private final StaffService staffService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public CheckInService(
            CheckInRepository checkInRepository,
            MemberRepository memberRepository,
            MembershipService membershipService,
            StaffService staffService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.checkInRepository = checkInRepository;
        this.memberRepository = memberRepository;
        this.membershipService = membershipService;
        this.staffService = staffService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Admits the member when they hold a covering membership at {@code asOf}.
     * Repeated visits on the same day are each recorded.
     */
    @Transactional
    public CheckInResult checkIn(UUID gymId, UUID memberId, String admittedBy, OffsetDateTime asOf) {
        String desk = normalizeAdmittedBy(admittedBy);
        AccessCheck access = membershipService.decideAccess(gymId, memberId, asOf);
        if (!access.granted()) {
            log.info("Check-in rejected member={} gym={} reason={}", memberId, gymId, access.decision());
            return CheckInResult.rejected(access.decision());
        }

        CheckIn checkIn = new CheckIn();
        checkIn.setGym(access.member().getGym());
        checkIn.setMember(access.member());
        checkIn.setCheckedInAt(asOf);
        checkIn.setCheckedInBy(desk);
        return CheckInResult.admitted(checkInRepository.save(checkIn));
    }

    @Transactional
    public CheckIn voidCheckIn(UUID gymId, UUID staffId, UUID checkInId) {
        StaffUser actor = staffService.requireActingStaff(gymId, staffId);
        CheckIn checkIn = checkInRepository.findById(checkInId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "CHECKIN_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, checkIn.getGym().getId(), RESOURCE_TYPE);
        if (checkIn.isDeleted()) {
            throw new BusinessRuleViolationException("CHECKIN_ALREADY_VOIDED", "Check-in is already voided");
        }
        checkIn.markDeleted(OffsetDateTime.now(clock));
        auditLogService.record(new AuditLogCommand(
                gymId,
                AuditLogService.CHECKIN_VOIDED,
                RESOURCE_TYPE,
                checkIn.getId().toString(),
                actor.getId(),
                Map.of("memberId", checkIn.getMember().getId().toString())
        ));
        return checkIn;
    }

    @Transactional(readOnly = true)
    public List<CheckIn> listCheckIns(UUID gymId, UUID memberId) {
        Member member = memberRepository.findById(memberId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, member.getGym().getId(), "Member");
        return checkInRepository.findByMember(gymId, memberId);
    }

    private static String normalizeAdmittedBy(String admittedBy) {
        if (admittedBy == null || admittedBy.isBlank()) {
            throw new BusinessRuleViolationException("ADMITTED_BY_REQUIRED", "Name who admitted the member");
        }
        String trimmed = admittedBy.trim();
        if (trimmed.length() > ADMITTED_BY_MAX_LENGTH) {
            throw new BusinessRuleViolationException("ADMITTED_BY_TOO_LONG",
                    "Admitted-by name is limited to " + ADMITTED_BY_MAX_LENGTH + " characters");
        }
        return trimmed;
    }
}
