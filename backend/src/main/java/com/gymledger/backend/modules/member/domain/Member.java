package com.gymledger.backend.modules.member.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymledger.backend.global.jpa.AbstractTimestampedEntity;
import com.gymledger.backend.global.jpa.SoftDeletable;
import com.gymledger.backend.modules.staff.domain.StaffUser;
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
@Table(name = "member")
public class Member extends AbstractTimestampedEntity implements SoftDeletable {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "gym_id", nullable = false, updatable = false)
    private Gym gym;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "created_by", nullable = false, updatable = false)
    private StaffUser createdBy;

    @Column(name = "member_number", nullable = false, updatable = false)
    private Long memberNumber;

    @Column(name = "member_code", nullable = false, updatable = false, length = 16)
    private String memberCode;

    @Column(name = "full_name", nullable = false, length = 150)
    private String fullName;

    @Column(name = "phone", nullable = false, length = 20)
    private String phone;

    @Column(name = "email", length = 320)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender", nullable = false, length = 1)
    private Gender gender;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private MemberStatus status = MemberStatus.ACTIVE;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    /**
     * Second phase of member creation. The code is derived from the reserved
     * number once; later calls leave it untouched.
     */
    public void assignCode(long reservedNumber) {
        if (memberCode != null) {
            return;
        }
        this.memberNumber = reservedNumber;
        this.memberCode = MemberCodeFormatter.toMemberCode(reservedNumber);
    }

    public boolean isActiveAndLive() {
        return !isDeleted() && status == MemberStatus.ACTIVE;
    }

    public UUID getId() {
        return id;
    }

    public Gym getGym() {
        return gym;
    }

    public void setGym(Gym gym) {
        this.gym = gym;
    }

    public StaffUser getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(StaffUser createdBy) {
        this.createdBy = createdBy;
    }

    public Long getMemberNumber() {
        return memberNumber;
    }

    public String getMemberCode() {
        return memberCode;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public Gender getGender() {
        return gender;
    }

    public void setGender(Gender gender) {
        this.gender = gender;
    }

    public LocalDate getDateOfBirth() {
        return dateOfBirth;
    }

    public void setDateOfBirth(LocalDate dateOfBirth) {
        this.dateOfBirth = dateOfBirth;
    }

    public MemberStatus getStatus() {
        return status;
    }

    public void setStatus(MemberStatus status) {
        this.status = status;
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
