package com.gymledger.backend.modules.membership.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymledger.backend.global.error.InvalidStatusTransitionException;
import com.gymledger.backend.global.jpa.AbstractTimestampedEntity;
import com.gymledger.backend.global.jpa.SoftDeletable;
import com.gymledger.backend.modules.member.domain.Member;
import com.gymledger.backend.modules.plan.domain.MembershipPlan;
import com.gymledger.backend.modules.tenant.domain.Gym;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One subscription period of a member. Dates are fixed when the row is created;
 * renewal produces a successor row instead of moving them.
 */
@Entity
@Table(name = "membership")
public class Membership extends AbstractTimestampedEntity implements SoftDeletable {

    public static final String RESOURCE_TYPE = "Membership";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "gym_id", nullable = false, updatable = false)
    private Gym gym;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "member_id", nullable = false, updatable = false)
    private Member member;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "membership_plan_id", nullable = false, updatable = false)
    private MembershipPlan plan;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false, updatable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private MembershipStatus status = MembershipStatus.ACTIVE;

    @Column(name = "auto_renew", nullable = false)
    private boolean autoRenew;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "renewed_by_id")
    private Membership renewedBy;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    protected Membership() {
    }

    public static Membership assign(Gym gym, Member member, MembershipPlan plan, LocalDate startDate, boolean autoRenew) {
        Membership membership = new Membership();
        membership.gym = gym;
        membership.member = member;
        membership.plan = plan;
        membership.startDate = startDate;
        membership.endDate = startDate.plusDays(plan.getDurationDays());
        membership.status = MembershipStatus.ACTIVE;
        membership.autoRenew = autoRenew;
        return membership;
    }

    public void transitionTo(MembershipStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(RESOURCE_TYPE, status, target);
        }
        this.status = target;
    }

    public void cancel(OffsetDateTime cancelledAt) {
        transitionTo(MembershipStatus.CANCELLED);
        this.cancelledAt = cancelledAt;
    }

    /**
     * Inclusive on both ends.
     */
    public boolean covers(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public boolean isRenewed() {
        return renewedBy != null;
    }

    public boolean isPastEnd(LocalDate asOfDate) {
        return asOfDate.isAfter(endDate);
    }

    /**
     * Status the row should hold at {@code asOfDate}. Terminal rows and rows
     * already renewed never move into the renewal window.
     */
    public MembershipStatus evaluate(LocalDate asOfDate, int renewalWindowDays) {
        if (status.isTerminal()) {
            return status;
        }
        if (isPastEnd(asOfDate)) {
            return MembershipStatus.EXPIRED;
        }
        if (status == MembershipStatus.ACTIVE
                && !isRenewed()
                && !asOfDate.isBefore(endDate.minusDays(renewalWindowDays))) {
            return MembershipStatus.PENDING_RENEWAL;
        }
        return status;
    }

    /**
     * Day the successor period starts: the day after this period ends, or
     * {@code asOfDate} when the period has already lapsed.
     */
    public LocalDate nextPeriodStart(LocalDate asOfDate) {
        return isPastEnd(asOfDate) ? asOfDate : endDate.plusDays(1);
    }

    public void markRenewedBy(Membership successor) {
        if (isRenewed()) {
            throw new IllegalStateException("Membership " + id + " is already renewed");
        }
        this.renewedBy = successor;
        if (status == MembershipStatus.PENDING_RENEWAL) {
            transitionTo(MembershipStatus.ACTIVE);
        }
    }

    public UUID getId() {
        return id;
    }

    public Gym getGym() {
        return gym;
    }

    public Member getMember() {
        return member;
    }

    public MembershipPlan getPlan() {
        return plan;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public MembershipStatus getStatus() {
        return status;
    }

    public boolean isAutoRenew() {
        return autoRenew;
    }

    public OffsetDateTime getCancelledAt() {
        return cancelledAt;
    }

    public Membership getRenewedBy() {
        return renewedBy;
    }

    @Override
    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }

    @Override
    public void markDeleted(OffsetDateTime deletedAt) {
        this.deletedAt = deletedAt;
    }

    @Override
    public void clearDeleted() {
        this.deletedAt = null;
    }
}
