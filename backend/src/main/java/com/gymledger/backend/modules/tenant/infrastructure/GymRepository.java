package com.gymledger.backend.modules.tenant.infrastructure;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.gymledger.backend.modules.tenant.domain.Gym;

public interface GymRepository extends JpaRepository<Gym, UUID> {

    Optional<Gym> findByIdAndDeletedAtIsNull(UUID id);

    Optional<Gym> findFirstByNameAndDeletedAtIsNull(String name);
}
