package com.gymledger.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.gymledger.backend.modules.audit.domain.AuditLog;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByGym_IdAndResourceTypeAndResourceKeyOrderByCreatedAtAsc(UUID gymId, String resourceType, String resourceKey);

    List<AuditLog> findByGym_IdAndActionTypeOrderByCreatedAtAsc(UUID gymId, String actionType);
}
