package com.gymledger.backend.modules.payment.infrastructure;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import com.gymledger.backend.modules.payment.domain.Payment;
import com.gymledger.backend.modules.payment.domain.PaymentStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Payment p where p.id = :id")
    Optional<Payment> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            select p.id
              from Payment p
             where p.gym.id = :gymId
               and p.member.id = :memberId
               and p.deletedAt is null
               and p.status = com.gymledger.backend.modules.payment.domain.PaymentStatus.PENDING
             order by p.createdAt asc
            """)
    List<UUID> findPendingIdsByMember(@Param("gymId") UUID gymId, @Param("memberId") UUID memberId);

    // member tombstones are not filtered: the ledger keeps every row visible
    @Query("""
            select p
              from Payment p
             where p.gym.id = :gymId
               and p.deletedAt is null
             order by p.createdAt desc
            """)
    List<Payment> findLedger(@Param("gymId") UUID gymId);

    @Query("""
            select p
              from Payment p
             where p.gym.id = :gymId
               and p.member.id = :memberId
               and p.deletedAt is null
             order by p.createdAt desc
            """)
    List<Payment> findLedgerByMember(@Param("gymId") UUID gymId, @Param("memberId") UUID memberId);

    @Query("""
            select new com.gymledger.backend.modules.payment.infrastructure.RevenueLine(
                       p.purpose, p.status, sum(p.amount), count(p))
              from Payment p
             where p.gym.id = :gymId
               and p.deletedAt is null
               and p.status in :statuses
               and p.paidAt >= :from
               and p.paidAt < :to
             group by p.purpose, p.status
            """)
    List<RevenueLine> summarizeRevenue(
            @Param("gymId") UUID gymId,
            @Param("statuses") Collection<PaymentStatus> statuses,
            @Param("from") OffsetDateTime from,
            @Param("to") OffsetDateTime to
    );
}
