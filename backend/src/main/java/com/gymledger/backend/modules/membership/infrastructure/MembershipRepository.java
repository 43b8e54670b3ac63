package com.gymledger.backend.modules.membership.infrastructure;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import com.gymledger.backend.modules.membership.domain.Membership;
import com.gymledger.backend.modules.membership.domain.MembershipStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MembershipRepository extends JpaRepository<Membership, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select ms from Membership ms where ms.id = :id")
    Optional<Membership> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Rows the status sweep may move, locked until the sweep commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select ms
              from Membership ms
             where ms.gym.id = :gymId
               and ms.deletedAt is null
               and ms.status in :statuses
             order by ms.startDate asc, ms.id asc
            """)
    List<Membership> findSweepCandidatesForUpdate(
            @Param("gymId") UUID gymId,
            @Param("statuses") Collection<MembershipStatus> statuses
    );

    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("""
            select ms
              from Membership ms
             where ms.gym.id = :gymId
               and ms.member.id = :memberId
               and ms.deletedAt is null
               and ms.status in :statuses
            """)
    List<Membership> findAccessCandidatesForShare(
            @Param("gymId") UUID gymId,
            @Param("memberId") UUID memberId,
            @Param("statuses") Collection<MembershipStatus> statuses
    );

    @Query("""
            select ms.id
              from Membership ms
             where ms.gym.id = :gymId
               and ms.member.id = :memberId
               and ms.deletedAt is null
               and ms.status in :statuses
             order by ms.startDate asc
            """)
    List<UUID> findIdsByMemberAndStatuses(
            @Param("gymId") UUID gymId,
            @Param("memberId") UUID memberId,
            @Param("statuses") Collection<MembershipStatus> statuses
    );

    @Query("""
            select ms
              from Membership ms
              join fetch ms.plan
             where ms.gym.id = :gymId
               and ms.member.id = :memberId
               and ms.deletedAt is null
             order by ms.startDate asc, ms.createdAt asc
            """)
    List<Membership> findByMember(@Param("gymId") UUID gymId, @Param("memberId") UUID memberId);

    @Query("""
            select count(ms)
              from Membership ms
             where ms.gym.id = :gymId
               and ms.deletedAt is null
               and ms.startDate between :from and :to
            """)
    long countStarted(@Param("gymId") UUID gymId, @Param("from") LocalDate from, @Param("to") LocalDate to);

    @Query("""
            select count(ms)
              from Membership ms
             where ms.gym.id = :gymId
               and ms.deletedAt is null
               and ms.status = com.gymledger.backend.modules.membership.domain.MembershipStatus.EXPIRED
               and ms.endDate between :from and :to
            """)
    long countExpired(@Param("gymId") UUID gymId, @Param("from") LocalDate from, @Param("to") LocalDate to);

    @Query("""
            select count(ms)
              from Membership ms
             where ms.gym.id = :gymId
               and ms.deletedAt is null
               and ms.status = com.gymledger.backend.modules.membership.domain.MembershipStatus.CANCELLED
               and ms.cancelledAt >= :from
               and ms.cancelledAt < :to
            """)
    long countCancelled(@Param("gymId") UUID gymId, @Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);
}
