package com.gymledger.backend.modules.member.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.gymledger.backend.global.error.BusinessRuleViolationException;
import com.gymledger.backend.global.error.DuplicateIdentityException;
import com.gymledger.backend.global.error.InvalidEnumValueException;
import com.gymledger.backend.global.error.ProblemException;
import com.gymledger.backend.global.tenant.TenantGuard;
import com.gymledger.backend.modules.audit.application.AuditLogService;
import com.gymledger.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.gymledger.backend.modules.member.domain.Gender;
import com.gymledger.backend.modules.member.domain.Member;
import com.gymledger.backend.modules.member.domain.MemberStatus;
import com.gymledger.backend.modules.member.domain.RestoreOffer;
import com.gymledger.backend.modules.member.infrastructure.MemberRepository;
import com.gymledger.backend.modules.membership.domain.MembershipStatus;
import com.gymledger.backend.modules.membership.infrastructure.MembershipRepository;
import com.gymledger.backend.modules.payment.infrastructure.PaymentRepository;
import com.gymledger.backend.modules.staff.application.StaffService;
import com.gymledger.backend.modules.staff.domain.StaffUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class MemberService {

    private static final Logger log = LoggerFactory.getLogger(MemberService.class);

    static final String DUPLICATE_PHONE = "DUPLICATE_PHONE";
    static final String DUPLICATE_EMAIL = "DUPLICATE_EMAIL";
    private static final String RESOURCE_TYPE = "Member";

    private final MemberRepository memberRepository;
    private final MembershipRepository membershipRepository;
    private final PaymentRepository paymentRepository;
    private final StaffService staffService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public MemberService(
            MemberRepository memberRepository,
            MembershipRepository membershipRepository,
            PaymentRepository paymentRepository,
            StaffService staffService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.memberRepository = memberRepository;
        this.membershipRepository = membershipRepository;
        this.paymentRepository = paymentRepository;
        this.staffService = staffService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional
    public Member createMember(UUID gymId, UUID staffId, MemberAttributes attributes) {
        StaffUser actor = staffService.requireActingStaff(gymId, staffId);

        String phone = requirePhone(attributes.phone());
        String email = normalizeEmail(attributes.email());
        ensurePhoneAvailable(gymId, phone, true);
        if (email != null) {
            ensureEmailAvailable(gymId, email, null, true);
        }

        Member member = new Member();
        member.setGym(actor.getGym());
        member.setCreatedBy(actor);
        member.setFullName(requireName(attributes.fullName()));
        member.setPhone(phone);
        member.setEmail(email);
        member.setGender(InvalidEnumValueException.parse(Gender.class, "gender", attributes.gender()));
        member.setDateOfBirth(attributes.dateOfBirth());
        member.setStatus(attributes.status() == null
                ? MemberStatus.ACTIVE
                : InvalidEnumValueException.parse(MemberStatus.class, "status", attributes.status()));

        // number first, code second; the code is derived once and never rewritten
        Long reserved = memberRepository.reserveMemberNumber();
        member.assignCode(reserved);

        Member saved;
        try {
            saved = memberRepository.saveAndFlush(member);
        } catch (DataIntegrityViolationException ex) {
            throw translateIdentityViolation(ex);
        }

        auditLogService.record(new AuditLogCommand(
                gymId,
                AuditLogService.MEMBER_CREATED,
                RESOURCE_TYPE,
                saved.getId().toString(),
                actor.getId(),
                Map.of("memberCode", saved.getMemberCode())
        ));
        return saved;
    }

    @Transactional(readOnly = true)
    public RestoreOffer findOrOfferRestore(UUID gymId, String phone) {
        String normalized = requirePhone(phone);
        Optional<Member> live = memberRepository.findLiveByPhone(gymId, normalized);
        if (live.isPresent()) {
            return RestoreOffer.liveConflict(live.get().getId());
        }
        return memberRepository.findDeletedByPhone(gymId, normalized).stream()
                .findFirst()
                .map(RestoreOffer::restorable)
                .orElseGet(RestoreOffer::none);
    }

    @Transactional(readOnly = true)
    public Member getMember(UUID gymId, UUID memberId) {
        Member member = memberRepository.findById(memberId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, member.getGym().getId(), RESOURCE_TYPE);
        return member;
    }

    @Transactional(readOnly = true)
    public Page<Member> listMembers(UUID gymId, boolean includeDeleted, Pageable pageable) {
        return memberRepository.findByGym(gymId, includeDeleted, pageable);
    }

    @Transactional
    public Member updateMember(UUID gymId, UUID staffId, UUID memberId, MemberAttributes attributes) {
        staffService.requireActingStaff(gymId, staffId);
        Member member = lockMember(gymId, memberId);
        if (member.isDeleted()) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND");
        }

        if (StringUtils.hasText(attributes.fullName())) {
            member.setFullName(requireName(attributes.fullName()));
        }
        if (attributes.phone() != null) {
            String phone = requirePhone(attributes.phone());
            if (!phone.equals(member.getPhone())) {
                memberRepository.findLiveByPhone(gymId, phone)
                        .filter(other -> !other.getId().equals(member.getId()))
                        .ifPresent(other -> {
                            throw DuplicateIdentityException.liveConflict(DUPLICATE_PHONE, "phone", other.getId());
                        });
                member.setPhone(phone);
            }
        }
        if (attributes.email() != null) {
            String email = normalizeEmail(attributes.email());
            if (email != null) {
                ensureEmailAvailable(gymId, email, member.getId(), false);
            }
            member.setEmail(email);
        }
        if (attributes.gender() != null) {
            member.setGender(InvalidEnumValueException.parse(Gender.class, "gender", attributes.gender()));
        }
        if (attributes.dateOfBirth() != null) {
            member.setDateOfBirth(attributes.dateOfBirth());
        }
        if (attributes.status() != null) {
            member.setStatus(InvalidEnumValueException.parse(MemberStatus.class, "status", attributes.status()));
        }

        try {
            return memberRepository.saveAndFlush(member);
        } catch (DataIntegrityViolationException ex) {
            throw translateIdentityViolation(ex);
        }
    }

    /**
     * Tombstones the member. Refused while the member still holds a running
     * membership or an unsettled payment; the refusal lists them.
     */
    @Transactional
    public void softDelete(UUID gymId, UUID staffId, UUID memberId) {
        StaffUser actor = staffService.requireActingStaff(gymId, staffId);
        Member member = lockMember(gymId, memberId);
        if (member.isDeleted()) {
            throw new BusinessRuleViolationException("MEMBER_ALREADY_DELETED", "Member is already deleted");
        }

        List<UUID> blockingMemberships = membershipRepository.findIdsByMemberAndStatuses(
                gymId, memberId, MembershipStatus.accessGranting());
        List<UUID> pendingPayments = paymentRepository.findPendingIdsByMember(gymId, memberId);
        if (!blockingMemberships.isEmpty() || !pendingPayments.isEmpty()) {
            Map<String, Object> blockers = new LinkedHashMap<>();
            blockers.put("membershipIds", blockingMemberships);
            blockers.put("pendingPaymentIds", pendingPayments);
            String code = blockingMemberships.isEmpty() ? "MEMBER_HAS_PENDING_PAYMENTS" : "MEMBER_HAS_ACTIVE_MEMBERSHIP";
            throw new BusinessRuleViolationException(code, "Member still has open memberships or payments", blockers);
        }

        member.markDeleted(OffsetDateTime.now(clock));
        auditLogService.record(new AuditLogCommand(
                gymId,
                AuditLogService.MEMBER_DELETED,
                RESOURCE_TYPE,
                member.getId().toString(),
                actor.getId(),
                Map.of("memberCode", member.getMemberCode())
        ));
        log.info("Member {} deleted in gym {}", member.getMemberCode(), gymId);
    }

    /**
     * Clears the tombstone. Memberships that lapsed while the member was deleted
     * stay as they are.
     */
    @Transactional
    public Member restore(UUID gymId, UUID staffId, UUID memberId) {
        StaffUser actor = staffService.requireActingStaff(gymId, staffId);
        Member member = lockMember(gymId, memberId);
        if (!member.isDeleted()) {
            throw new BusinessRuleViolationException("MEMBER_NOT_DELETED", "Member is not deleted");
        }

        memberRepository.findLiveByPhone(gymId, member.getPhone())
                .ifPresent(other -> {
                    throw DuplicateIdentityException.liveConflict(DUPLICATE_PHONE, "phone", other.getId());
                });
        if (member.getEmail() != null) {
            memberRepository.findLiveByEmail(gymId, member.getEmail())
                    .ifPresent(other -> {
                        throw DuplicateIdentityException.liveConflict(DUPLICATE_EMAIL, "email", other.getId());
                    });
        }

        member.clearDeleted();
        Member saved;
        try {
            saved = memberRepository.saveAndFlush(member);
        } catch (DataIntegrityViolationException ex) {
            throw translateIdentityViolation(ex);
        }
        auditLogService.record(new AuditLogCommand(
                gymId,
                AuditLogService.MEMBER_RESTORED,
                RESOURCE_TYPE,
                saved.getId().toString(),
                actor.getId(),
                Map.of("memberCode", saved.getMemberCode())
        ));
        log.info("Member {} restored in gym {}", saved.getMemberCode(), gymId);
        return saved;
    }

    private Member lockMember(UUID gymId, UUID memberId) {
        Member member = memberRepository.findByIdForUpdate(memberId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, member.getGym().getId(), RESOURCE_TYPE);
        return member;
    }

    private void ensurePhoneAvailable(UUID gymId, String phone, boolean offerRestore) {
        memberRepository.findLiveByPhone(gymId, phone).ifPresent(other -> {
            throw DuplicateIdentityException.liveConflict(DUPLICATE_PHONE, "phone", other.getId());
        });
        if (offerRestore) {
            memberRepository.findDeletedByPhone(gymId, phone).stream().findFirst().ifPresent(deleted -> {
                throw DuplicateIdentityException.restorable(DUPLICATE_PHONE, "phone", deleted.getId());
            });
        }
    }

    private void ensureEmailAvailable(UUID gymId, String email, UUID selfId, boolean offerRestore) {
        memberRepository.findLiveByEmail(gymId, email)
                .filter(other -> !other.getId().equals(selfId))
                .ifPresent(other -> {
                    throw DuplicateIdentityException.liveConflict(DUPLICATE_EMAIL, "email", other.getId());
                });
        if (offerRestore) {
            memberRepository.findDeletedByEmail(gymId, email).stream().findFirst().ifPresent(deleted -> {
                throw DuplicateIdentityException.restorable(DUPLICATE_EMAIL, "email", deleted.getId());
            });
        }
    }

    /**
     * A concurrent insert can slip past the pre-checks; the partial unique
     * indexes still reject it. The failed statement aborts the transaction, so the
     * conflicting row cannot be looked up here.
     */
    private RuntimeException translateIdentityViolation(DataIntegrityViolationException ex) {
        String message = NestedExceptionUtils.getMostSpecificCause(ex).getMessage();
        if (message != null && message.contains("ux_member_phone_live")) {
            return new DuplicateIdentityException(DUPLICATE_PHONE, "A live member already uses this phone", null, null);
        }
        if (message != null && message.contains("ux_member_email_live")) {
            return new DuplicateIdentityException(DUPLICATE_EMAIL, "A live member already uses this email", null, null);
        }
        return ex;
    }

    private static String requirePhone(String phone) {
        if (phone == null || phone.isBlank()) {
            throw new BusinessRuleViolationException("INVALID_PHONE", "Phone number is required");
        }
        return phone.trim();
    }

    private static String requireName(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            throw new BusinessRuleViolationException("INVALID_NAME", "Member name is required");
        }
        return fullName.trim();
    }

    private static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return email.trim();
    }

    public record MemberAttributes(
            String fullName,
            String phone,
            String email,
            String gender,
            LocalDate dateOfBirth,
            String status
    ) {
    }
}
