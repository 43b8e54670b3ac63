package com.gymledger.backend.modules.payment.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymledger.backend.global.error.InvalidStatusTransitionException;
import com.gymledger.backend.global.jpa.AbstractTimestampedEntity;
import com.gymledger.backend.global.jpa.SoftDeletable;
import com.gymledger.backend.modules.member.domain.Member;
import com.gymledger.backend.modules.membership.domain.Membership;
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

@Entity
@Table(name = "payment")
public class Payment extends AbstractTimestampedEntity implements SoftDeletable {

    public static final String RESOURCE_TYPE = "Payment";

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

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "membership_id", updatable = false)
    private Membership membership;

    @Column(name = "amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_for", nullable = false, updatable = false, length = 16)
    private PaymentPurpose purpose;

    @Enumerated(EnumType.STRING)
    @Column(name = "method", nullable = false, updatable = false, length = 16)
    private PaymentMethod method;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PaymentStatus status;

    @Column(name = "paid_at")
    private OffsetDateTime paidAt;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    protected Payment() {
    }

    public static Payment record(
            Gym gym,
            Member member,
            Membership membership,
            BigDecimal amount,
            PaymentPurpose purpose,
            PaymentMethod method,
            PaymentStatus status,
            String notes,
            OffsetDateTime recordedAt
    ) {
        Payment payment = new Payment();
        payment.gym = gym;
        payment.member = member;
        payment.membership = membership;
        payment.amount = amount;
        payment.purpose = purpose;
        payment.method = method;
        payment.status = status;
        payment.notes = notes;
        if (status == PaymentStatus.PAID) {
            payment.paidAt = recordedAt;
        }
        return payment;
    }

    /**
     * Only the status moves; the amount is fixed once recorded.
     */
    public void transitionTo(PaymentStatus target, OffsetDateTime at) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(RESOURCE_TYPE, status, target);
        }
        if (target == PaymentStatus.PAID) {
            this.paidAt = at;
        }
        this.status = target;
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

    public Membership getMembership() {
        return membership;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public PaymentPurpose getPurpose() {
        return purpose;
    }

    public PaymentMethod getMethod() {
        return method;
    }

    public PaymentStatus getStatus() {
        return status;
    }

    public OffsetDateTime getPaidAt() {
        return paidAt;
    }

    public String getNotes() {
        return notes;
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
