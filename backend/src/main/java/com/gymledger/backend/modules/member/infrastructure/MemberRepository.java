package com.gymledger.backend.modules.member.infrastructure;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import com.gymledger.backend.modules.member.domain.Member;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemberRepository extends JpaRepository<Member, UUID> {

    @Query(value = "select nextval('member_number_seq')", nativeQuery = true)
    Long reserveMemberNumber();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from Member m where m.id = :id")
    Optional<Member> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            select m
              from Member m
             where m.gym.id = :gymId
               and m.phone = :phone
               and m.deletedAt is null
            """)
    Optional<Member> findLiveByPhone(@Param("gymId") UUID gymId, @Param("phone") String phone);

    @Query("""
            select m
              from Member m
             where m.gym.id = :gymId
               and lower(m.email) = lower(:email)
               and m.deletedAt is null
            """)
    Optional<Member> findLiveByEmail(@Param("gymId") UUID gymId, @Param("email") String email);

    @Query("""
            select m
              from Member m
             where m.gym.id = :gymId
               and m.phone = :phone
               and m.deletedAt is not null
             order by m.deletedAt desc
            """)
    List<Member> findDeletedByPhone(@Param("gymId") UUID gymId, @Param("phone") String phone);

    @Query("""
            select m
              from Member m
             where m.gym.id = :gymId
               and lower(m.email) = lower(:email)
               and m.deletedAt is not null
             order by m.deletedAt desc
            """)
    List<Member> findDeletedByEmail(@Param("gymId") UUID gymId, @Param("email") String email);

    @Query(value = """
            select m
              from Member m
             where m.gym.id = :gymId
               and (:includeDeleted = true or m.deletedAt is null)
            """,
            countQuery = """
            select count(m)
              from Member m
             where m.gym.id = :gymId
               and (:includeDeleted = true or m.deletedAt is null)
            """)
    Page<Member> findByGym(@Param("gymId") UUID gymId, @Param("includeDeleted") boolean includeDeleted, Pageable pageable);
}
