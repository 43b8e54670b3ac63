package com.gymledger.backend.modules.member;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.gymledger.backend.global.error.BusinessRuleViolationException;
import com.gymledger.backend.global.error.DuplicateIdentityException;
import com.gymledger.backend.global.error.InvalidEnumValueException;
import com.gymledger.backend.modules.audit.application.AuditLogService;
import com.gymledger.backend.modules.audit.domain.AuditLog;
import com.gymledger.backend.modules.member.application.MemberService;
import com.gymledger.backend.modules.member.application.MemberService.MemberAttributes;
import com.gymledger.backend.modules.member.domain.Member;
import com.gymledger.backend.modules.member.domain.MemberCodeFormatter;
import com.gymledger.backend.modules.member.domain.RestoreOffer;
import com.gymledger.backend.modules.membership.application.MembershipService;
import com.gymledger.backend.modules.membership.application.MembershipService.AssignmentCommand;
import com.gymledger.backend.modules.membership.domain.Membership;
import com.gymledger.backend.modules.plan.domain.MembershipPlan;
import com.gymledger.backend.support.AbstractPostgresIntegrationTest;
import com.gymledger.backend.support.TestTenantFactory;
import com.gymledger.backend.support.TestTenantFactory.Tenant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

@SpringBootTest
class MemberRegistryIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PHONE = "+6281234567890";

    @Autowired
    private TestTenantFactory tenantFactory;

    @Autowired
    private MemberService memberService;

    @Autowired
    private MembershipService membershipService;

    @Autowired
    private AuditLogService auditLogService;

    private Tenant tenant;

    @BeforeEach
    void setUp() {
        tenant = tenantFactory.createTenant("Nyx Gym");
    }

    @Test
    void membersReceiveDistinctWellFormedCodes() {
        Member first = tenantFactory.createMember(tenant, "Andi Wijaya", "+6281000000001");
        Member second = tenantFactory.createMember(tenant, "Bella Sari", "+6281000000002");

        assertThat(MemberCodeFormatter.isValid(first.getMemberCode())).isTrue();
        assertThat(MemberCodeFormatter.isValid(second.getMemberCode())).isTrue();
        assertThat(second.getMemberNumber()).isGreaterThan(first.getMemberNumber());
        assertThat(second.getMemberCode()).isNotEqualTo(first.getMemberCode());
    }

    @Test
    void livePhoneCannotBeRegisteredTwice() {
        Member existing = tenantFactory.createMember(tenant, "Andi Wijaya", PHONE);

        assertThatThrownBy(() -> tenantFactory.createMember(tenant, "Someone Else", PHONE))
                .isInstanceOfSatisfying(DuplicateIdentityException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("DUPLICATE_PHONE");
                    assertThat(ex.getConflictingMemberId()).isEqualTo(existing.getId());
                });
    }

    @Test
    void samePhoneIsAllowedInAnotherGym() {
        tenantFactory.createMember(tenant, "Andi Wijaya", PHONE);
        Tenant other = tenantFactory.createTenant("Iron Temple");

        Member elsewhere = tenantFactory.createMember(other, "Andi Wijaya", PHONE);

        assertThat(elsewhere.getGym().getId()).isEqualTo(other.gymId());
    }

    @Test
    void liveEmailConflictIsCaseInsensitive() {
        memberService.createMember(tenant.gymId(), tenant.staffId(),
                new MemberAttributes("Andi Wijaya", "+6281000000001", "andi@example.com", "M", null, null));

        assertThatThrownBy(() -> memberService.createMember(tenant.gymId(), tenant.staffId(),
                new MemberAttributes("Andi W", "+6281000000002", "ANDI@example.com", "M", null, null)))
                .isInstanceOfSatisfying(DuplicateIdentityException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("DUPLICATE_EMAIL"));
    }

    @Test
    void unknownGenderIsRejected() {
        assertThatThrownBy(() -> memberService.createMember(tenant.gymId(), tenant.staffId(),
                new MemberAttributes("Andi Wijaya", PHONE, null, "X", LocalDate.of(1990, 5, 1), null)))
                .isInstanceOf(InvalidEnumValueException.class);
    }

    @Test
    @DisplayName("deleting a member is refused while a membership runs, then allowed once it is cancelled")
    void softDeleteGuardAndRestoreKeepCode() {
        MembershipPlan monthly = tenantFactory.createPlan(tenant, "Monthly", 30, "250000");
        Member member = tenantFactory.createMember(tenant, "Andi Wijaya", PHONE);
        Membership membership = membershipService.assign(tenant.gymId(), tenant.staffId(),
                new AssignmentCommand(member.getId(), monthly.getId(), LocalDate.of(2026, 1, 1), false, false));

        assertThatThrownBy(() -> memberService.softDelete(tenant.gymId(), tenant.staffId(), member.getId()))
                .isInstanceOfSatisfying(BusinessRuleViolationException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("MEMBER_HAS_ACTIVE_MEMBERSHIP");
                    assertThat(ex.getContext().get("membershipIds")).isEqualTo(List.of(membership.getId()));
                });

        membershipService.cancel(tenant.gymId(), tenant.staffId(), membership.getId());
        memberService.softDelete(tenant.gymId(), tenant.staffId(), member.getId());

        assertThatThrownBy(() -> memberService.softDelete(tenant.gymId(), tenant.staffId(), member.getId()))
                .isInstanceOfSatisfying(BusinessRuleViolationException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("MEMBER_ALREADY_DELETED"));

        assertThatThrownBy(() -> tenantFactory.createMember(tenant, "Andi Wijaya", PHONE))
                .isInstanceOfSatisfying(DuplicateIdentityException.class, ex -> {
                    assertThat(ex.isRestorable()).isTrue();
                    assertThat(ex.getRestoreCandidateId()).isEqualTo(member.getId());
                });

        RestoreOffer offer = memberService.findOrOfferRestore(tenant.gymId(), PHONE);
        assertThat(offer.kind()).isEqualTo(RestoreOffer.Kind.RESTORABLE);
        assertThat(offer.memberId()).isEqualTo(member.getId());

        Member restored = memberService.restore(tenant.gymId(), tenant.staffId(), member.getId());
        assertThat(restored.isDeleted()).isFalse();
        assertThat(restored.getMemberCode()).isEqualTo(member.getMemberCode());
        assertThat(memberService.findOrOfferRestore(tenant.gymId(), PHONE).kind())
                .isEqualTo(RestoreOffer.Kind.LIVE_CONFLICT);

        List<AuditLog> history = auditLogService.history(tenant.gymId(), "Member", member.getId());
        assertThat(history).extracting(AuditLog::getActionType).containsExactly(
                AuditLogService.MEMBER_CREATED,
                AuditLogService.MEMBER_DELETED,
                AuditLogService.MEMBER_RESTORED);
    }

    @Test
    void restoreOfLiveMemberIsRefused() {
        Member member = tenantFactory.createMember(tenant, "Andi Wijaya", PHONE);

        assertThatThrownBy(() -> memberService.restore(tenant.gymId(), tenant.staffId(), member.getId()))
                .isInstanceOfSatisfying(BusinessRuleViolationException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("MEMBER_NOT_DELETED"));
    }

    @Test
    void listingHidesTombstonesUnlessAsked() {
        tenantFactory.createMember(tenant, "Andi Wijaya", "+6281000000001");
        Member leaver = tenantFactory.createMember(tenant, "Bella Sari", "+6281000000002");
        memberService.softDelete(tenant.gymId(), tenant.staffId(), leaver.getId());

        PageRequest page = PageRequest.of(0, 20, Sort.by("memberNumber"));
        assertThat(memberService.listMembers(tenant.gymId(), false, page).getTotalElements()).isEqualTo(1);
        assertThat(memberService.listMembers(tenant.gymId(), true, page).getTotalElements()).isEqualTo(2);
        assertThat(memberService.getMember(tenant.gymId(), leaver.getId()).isDeleted()).isTrue();
    }

    @Test
    void unknownMemberIsNotFound() {
        assertThatThrownBy(() -> memberService.getMember(tenant.gymId(), UUID.randomUUID()))
                .hasMessageContaining("MEMBER_NOT_FOUND");
    }
}
