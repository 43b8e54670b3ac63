package com.gymledger.backend.modules.member.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.gymledger.backend.global.error.BusinessRuleViolationException;
import com.gymledger.backend.global.error.DuplicateIdentityException;
import com.gymledger.backend.global.error.TenantIsolationException;
import com.gymledger.backend.modules.audit.application.AuditLogService;
import com.gymledger.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.gymledger.backend.modules.member.application.MemberService.MemberAttributes;
import com.gymledger.backend.modules.member.domain.Member;
import com.gymledger.backend.modules.member.domain.MemberStatus;
import com.gymledger.backend.modules.member.infrastructure.MemberRepository;
import com.gymledger.backend.modules.membership.infrastructure.MembershipRepository;
import com.gymledger.backend.modules.payment.infrastructure.PaymentRepository;
import com.gymledger.backend.modules.staff.application.StaffService;
import com.gymledger.backend.modules.staff.domain.StaffRole;
import com.gymledger.backend.modules.staff.domain.StaffUser;
import com.gymledger.backend.modules.tenant.domain.Gym;
import com.gymledger.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class MemberServiceTest {

    private static final String PHONE = "+6281234567890";

    @Mock
    private MemberRepository memberRepository;

    @Mock
    private MembershipRepository membershipRepository;

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private StaffService staffService;

    @Mock
    private AuditLogService auditLogService;

    private MemberService memberService;
    private Gym gym;
    private StaffUser desk;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2026-01-15T09:00:00Z").toInstant(), ZoneOffset.UTC);
        memberService = new MemberService(
                memberRepository,
                membershipRepository,
                paymentRepository,
                staffService,
                auditLogService,
                clock
        );

        gym = TestEntities.gym(UUID.randomUUID());
        desk = new StaffUser();
        desk.setGym(gym);
        desk.setRole(StaffRole.STAFF);
        ReflectionTestUtils.setField(desk, "id", UUID.randomUUID());
    }

    @Test
    @DisplayName("the reserved number becomes the member code")
    void createMemberAssignsCodeFromReservedNumber() {
        when(staffService.requireActingStaff(gym.getId(), desk.getId())).thenReturn(desk);
        when(memberRepository.reserveMemberNumber()).thenReturn(7L);
        when(memberRepository.saveAndFlush(any(Member.class))).thenAnswer(invocation -> {
            Member member = invocation.getArgument(0);
            ReflectionTestUtils.setField(member, "id", UUID.randomUUID());
            return member;
        });

        Member created = memberService.createMember(gym.getId(), desk.getId(), attributes(" " + PHONE + " "));

        assertThat(created.getMemberCode()).isEqualTo("MBR-0007");
        assertThat(created.getPhone()).isEqualTo(PHONE);
        assertThat(created.getStatus()).isEqualTo(MemberStatus.ACTIVE);
        assertThat(created.getCreatedBy()).isSameAs(desk);

        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().actionType()).isEqualTo(AuditLogService.MEMBER_CREATED);
        assertThat(audit.getValue().actorStaffId()).isEqualTo(desk.getId());
    }

    @Test
    void livePhoneConflictIsRejectedBeforeReservingANumber() {
        Member existing = TestEntities.member(gym, UUID.randomUUID(), MemberStatus.ACTIVE);
        when(staffService.requireActingStaff(gym.getId(), desk.getId())).thenReturn(desk);
        when(memberRepository.findLiveByPhone(gym.getId(), PHONE)).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> memberService.createMember(gym.getId(), desk.getId(), attributes(PHONE)))
                .isInstanceOfSatisfying(DuplicateIdentityException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("DUPLICATE_PHONE");
                    assertThat(ex.getConflictingMemberId()).isEqualTo(existing.getId());
                    assertThat(ex.isRestorable()).isFalse();
                });
        verify(memberRepository, never()).reserveMemberNumber();
    }

    @Test
    @DisplayName("a tombstoned phone match is offered for restore instead of a new row")
    void tombstonedPhoneOffersRestore() {
        Member deleted = TestEntities.member(gym, UUID.randomUUID(), MemberStatus.ACTIVE);
        deleted.markDeleted(OffsetDateTime.parse("2026-01-01T00:00:00Z"));
        when(staffService.requireActingStaff(gym.getId(), desk.getId())).thenReturn(desk);
        when(memberRepository.findDeletedByPhone(gym.getId(), PHONE)).thenReturn(List.of(deleted));

        assertThatThrownBy(() -> memberService.createMember(gym.getId(), desk.getId(), attributes(PHONE)))
                .isInstanceOfSatisfying(DuplicateIdentityException.class, ex -> {
                    assertThat(ex.isRestorable()).isTrue();
                    assertThat(ex.getRestoreCandidateId()).isEqualTo(deleted.getId());
                });
        verify(memberRepository, never()).saveAndFlush(any());
    }

    @Test
    void softDeleteIsRefusedWhileMembershipRuns() {
        Member member = TestEntities.member(gym, UUID.randomUUID(), MemberStatus.ACTIVE);
        UUID runningMembership = UUID.randomUUID();
        when(staffService.requireActingStaff(gym.getId(), desk.getId())).thenReturn(desk);
        when(memberRepository.findByIdForUpdate(member.getId())).thenReturn(Optional.of(member));
        when(membershipRepository.findIdsByMemberAndStatuses(eq(gym.getId()), eq(member.getId()), any()))
                .thenReturn(List.of(runningMembership));

        assertThatThrownBy(() -> memberService.softDelete(gym.getId(), desk.getId(), member.getId()))
                .isInstanceOfSatisfying(BusinessRuleViolationException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("MEMBER_HAS_ACTIVE_MEMBERSHIP");
                    assertThat(ex.getContext().get("membershipIds")).isEqualTo(List.of(runningMembership));
                });
        assertThat(member.isDeleted()).isFalse();
        verify(auditLogService, never()).record(any());
    }

    @Test
    void softDeleteIsRefusedWhilePaymentIsPending() {
        Member member = TestEntities.member(gym, UUID.randomUUID(), MemberStatus.ACTIVE);
        when(staffService.requireActingStaff(gym.getId(), desk.getId())).thenReturn(desk);
        when(memberRepository.findByIdForUpdate(member.getId())).thenReturn(Optional.of(member));
        when(paymentRepository.findPendingIdsByMember(gym.getId(), member.getId()))
                .thenReturn(List.of(UUID.randomUUID()));

        assertThatThrownBy(() -> memberService.softDelete(gym.getId(), desk.getId(), member.getId()))
                .isInstanceOfSatisfying(BusinessRuleViolationException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("MEMBER_HAS_PENDING_PAYMENTS"));
    }

    @Test
    void softDeleteStampsTombstone() {
        Member member = TestEntities.member(gym, UUID.randomUUID(), MemberStatus.ACTIVE);
        member.assignCode(12);
        when(staffService.requireActingStaff(gym.getId(), desk.getId())).thenReturn(desk);
        when(memberRepository.findByIdForUpdate(member.getId())).thenReturn(Optional.of(member));

        memberService.softDelete(gym.getId(), desk.getId(), member.getId());

        assertThat(member.getDeletedAt()).isEqualTo(OffsetDateTime.parse("2026-01-15T09:00:00Z"));
        assertThat(member.getMemberCode()).isEqualTo("MBR-0012");
    }

    @Test
    void memberOfAnotherGymCannotBeDeleted() {
        Member foreign = TestEntities.member(TestEntities.gym(UUID.randomUUID()), UUID.randomUUID(), MemberStatus.ACTIVE);
        when(staffService.requireActingStaff(gym.getId(), desk.getId())).thenReturn(desk);
        when(memberRepository.findByIdForUpdate(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> memberService.softDelete(gym.getId(), desk.getId(), foreign.getId()))
                .isInstanceOf(TenantIsolationException.class);
        assertThat(foreign.isDeleted()).isFalse();
    }

    @Test
    void restoreIsRefusedWhenPhoneWasTakenMeanwhile() {
        Member deleted = TestEntities.member(gym, UUID.randomUUID(), MemberStatus.ACTIVE);
        deleted.markDeleted(OffsetDateTime.parse("2026-01-02T00:00:00Z"));
        Member newcomer = TestEntities.member(gym, UUID.randomUUID(), MemberStatus.ACTIVE);
        when(staffService.requireActingStaff(gym.getId(), desk.getId())).thenReturn(desk);
        when(memberRepository.findByIdForUpdate(deleted.getId())).thenReturn(Optional.of(deleted));
        when(memberRepository.findLiveByPhone(gym.getId(), deleted.getPhone())).thenReturn(Optional.of(newcomer));

        assertThatThrownBy(() -> memberService.restore(gym.getId(), desk.getId(), deleted.getId()))
                .isInstanceOfSatisfying(DuplicateIdentityException.class,
                        ex -> assertThat(ex.getConflictingMemberId()).isEqualTo(newcomer.getId()));
        assertThat(deleted.isDeleted()).isTrue();
    }

    private static MemberAttributes attributes(String phone) {
        return new MemberAttributes("Rina Putri", phone, null, "F", null, null);
    }
}
