package com.gymledger.backend.modules.checkin.infrastructure;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.gymledger.backend.modules.checkin.domain.CheckIn;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CheckInRepository extends JpaRepository<CheckIn, UUID> {

    @Query("""
            select c
              from CheckIn c
             where c.gym.id = :gymId
               and c.member.id = :memberId
               and c.deletedAt is null
             order by c.checkedInAt desc
            """)
    List<CheckIn> findByMember(@Param("gymId") UUID gymId, @Param("memberId") UUID memberId);

    @Query("""
            select count(c)
              from CheckIn c
             where c.gym.id = :gymId
               and c.deletedAt is null
               and c.checkedInAt >= :from
               and c.checkedInAt < :to
            """)
    long countVisits(@Param("gymId") UUID gymId, @Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);

    @Query("""
            select count(distinct c.member.id)
              from CheckIn c
             where c.gym.id = :gymId
               and c.deletedAt is null
               and c.checkedInAt >= :from
               and c.checkedInAt < :to
            """)
    long countDistinctMembers(@Param("gymId") UUID gymId, @Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);
}
