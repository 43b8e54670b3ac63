package com.gymledger.backend.modules.checkin.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymledger.backend.global.jpa.AbstractTimestampedEntity;
import com.gymledger.backend.global.jpa.SoftDeletable;
import com.gymledger.backend.modules.member.domain.Member;
import com.gymledger.backend.modules.tenant.domain.Gym;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "checkin")
public class CheckIn extends AbstractTimestampedEntity implements SoftDeletable {

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

    @Column(name = "checked_in_at", nullable = false, updatable = false)
    private OffsetDateTime checkedInAt;

    // free text typed at the desk; never resolved to a staff account
    @Column(name = "checked_in_by", nullable = false, updatable = false, length = 120)
    private String checkedInBy;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    public UUID getId() {
        return id;
    }

    public Gym getGym() {
        return gym;
    }

    public void setGym(Gym gym) {
        this.gym = gym;
    }

    public Member getMember() {
        return member;
    }

    public void setMember(Member member) {
        this.member = member;
    }

    public OffsetDateTime getCheckedInAt() {
        return checkedInAt;
    }

    public void setCheckedInAt(OffsetDateTime checkedInAt) {
        this.checkedInAt = checkedInAt;
    }

    public String getCheckedInBy() {
        return checkedInBy;
    }

    public void setCheckedInBy(String checkedInBy) {
        this.checkedInBy = checkedInBy;
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
