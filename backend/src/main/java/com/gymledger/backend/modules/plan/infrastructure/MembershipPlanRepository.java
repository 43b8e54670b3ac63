package com.gymledger.backend.modules.plan.infrastructure;

import java.util.List;
import java.util.UUID;

import com.gymledger.backend.modules.plan.domain.MembershipPlan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MembershipPlanRepository extends JpaRepository<MembershipPlan, UUID> {

    @Query("""
            select p
              from MembershipPlan p
             where p.gym.id = :gymId
               and p.deletedAt is null
               and (:activeOnly = false or p.active = true)
             order by p.durationDays asc, p.name asc
            """)
    List<MembershipPlan> findCatalog(@Param("gymId") UUID gymId, @Param("activeOnly") boolean activeOnly);
}
