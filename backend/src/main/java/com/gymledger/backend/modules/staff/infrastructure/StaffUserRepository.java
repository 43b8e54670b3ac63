package com.gymledger.backend.modules.staff.infrastructure;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.gymledger.backend.modules.staff.domain.StaffUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StaffUserRepository extends JpaRepository<StaffUser, UUID> {

    @Query("select s from StaffUser s join fetch s.gym where lower(s.email) = lower(:email)")
    Optional<StaffUser> findByEmailIgnoreCase(@Param("email") String email);

    @Query("select case when count(s) > 0 then true else false end from StaffUser s where lower(s.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select s
              from StaffUser s
             where s.gym.id = :gymId
               and (:includeDeleted = true or s.deletedAt is null)
             order by s.createdAt asc
            """)
    List<StaffUser> findByGym(@Param("gymId") UUID gymId, @Param("includeDeleted") boolean includeDeleted);
}
