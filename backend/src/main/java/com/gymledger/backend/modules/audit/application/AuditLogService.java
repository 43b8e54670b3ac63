package com.gymledger.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.gymledger.backend.modules.audit.domain.AuditLog;
import com.gymledger.backend.modules.audit.infrastructure.AuditLogRepository;
import com.gymledger.backend.modules.staff.domain.StaffUser;
import com.gymledger.backend.modules.tenant.domain.Gym;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    public static final String MEMBER_CREATED = "MEMBER_CREATED";
    public static final String MEMBER_DELETED = "MEMBER_DELETED";
    public static final String MEMBER_RESTORED = "MEMBER_RESTORED";
    public static final String MEMBERSHIP_ASSIGNED = "MEMBERSHIP_ASSIGNED";
    public static final String MEMBERSHIP_CANCELLED = "MEMBERSHIP_CANCELLED";
    public static final String MEMBERSHIP_RENEWED = "MEMBERSHIP_RENEWED";
    public static final String PAYMENT_RECORDED = "PAYMENT_RECORDED";
    public static final String PAYMENT_STATUS_CHANGED = "PAYMENT_STATUS_CHANGED";
    public static final String CHECKIN_VOIDED = "CHECKIN_VOIDED";
    public static final String STAFF_CREATED = "STAFF_CREATED";
    public static final String STAFF_STATUS_CHANGED = "STAFF_STATUS_CHANGED";

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, EntityManager entityManager, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.gymId(), "gymId is required");
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setGym(entityManager.getReference(Gym.class, command.gymId()));
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.actorStaffId() != null) {
            auditLog.setActor(entityManager.getReference(StaffUser.class, command.actorStaffId()));
        }

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    @Transactional(readOnly = true)
    public List<AuditLog> history(UUID gymId, String resourceType, UUID resourceId) {
        return auditLogRepository.findByGym_IdAndResourceTypeAndResourceKeyOrderByCreatedAtAsc(
                gymId, resourceType, resourceId.toString());
    }

    public record AuditLogCommand(
            UUID gymId,
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorStaffId,
            Map<String, Object> detail
    ) {
    }
}
