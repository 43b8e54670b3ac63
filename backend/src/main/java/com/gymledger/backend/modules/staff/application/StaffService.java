package com.gymledger.backend.modules.staff.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.gymledger.backend.global.error.BusinessRuleViolationException;
import com.gymledger.backend.global.error.ProblemException;
import com.gymledger.backend.global.tenant.TenantGuard;
import com.gymledger.backend.modules.audit.application.AuditLogService;
import com.gymledger.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.gymledger.backend.modules.staff.domain.StaffRole;
import com.gymledger.backend.modules.staff.domain.StaffStatus;
import com.gymledger.backend.modules.staff.domain.StaffUser;
import com.gymledger.backend.modules.staff.infrastructure.StaffUserRepository;
import com.gymledger.backend.modules.tenant.domain.Gym;
import com.gymledger.backend.modules.tenant.infrastructure.GymRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Staff registry. {@link #requireActingStaff(UUID, UUID)} is the identity
 * boundary every mutating operation of the other modules goes through.
 */
@Service
public class StaffService {

    private static final Logger log = LoggerFactory.getLogger(StaffService.class);
    private static final String RESOURCE_TYPE = "Staff";

    private final StaffUserRepository staffUserRepository;
    private final GymRepository gymRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public StaffService(
            StaffUserRepository staffUserRepository,
            GymRepository gymRepository,
            PasswordEncoder passwordEncoder,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.staffUserRepository = staffUserRepository;
        this.gymRepository = gymRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public StaffUser requireActingStaff(UUID gymId, UUID staffId) {
        StaffUser staff = staffUserRepository.findById(staffId)
                .filter(candidate -> !candidate.isDeleted())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "STAFF_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, staff.getGym().getId(), RESOURCE_TYPE);
        if (staff.getStatus() != StaffStatus.ACTIVE) {
            throw new BusinessRuleViolationException("STAFF_INACTIVE", "Staff account is inactive");
        }
        return staff;
    }

    /**
     * Standing of the account behind an access token, checked on every request.
     * Offboarded accounts answer 401 and deactivated ones 403, as at login.
     */
    @Transactional(readOnly = true)
    public void requireSignedInStaff(UUID gymId, UUID staffId) {
        StaffUser staff = staffUserRepository.findById(staffId)
                .filter(candidate -> !candidate.isDeleted())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "STAFF_OFFBOARDED",
                        "Staff account no longer exists"));
        TenantGuard.requireSameTenant(gymId, staff.getGym().getId(), RESOURCE_TYPE);
        if (staff.getStatus() != StaffStatus.ACTIVE) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "STAFF_INACTIVE", "Staff account is inactive");
        }
    }

    @Transactional(readOnly = true)
    public StaffUser requireActingOwner(UUID gymId, UUID staffId) {
        StaffUser staff = requireActingStaff(gymId, staffId);
        if (!staff.isOwner()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "OWNER_ROLE_REQUIRED", "This action is reserved for the gym owner");
        }
        return staff;
    }

    /**
     * First account of a freshly created gym. Only used by onboarding, which has
     * no acting staff yet.
     */
    @Transactional
    public StaffUser createOwner(Gym gym, StaffAttributes attributes) {
        StaffUser owner = newStaff(gym, attributes, StaffRole.OWNER);
        return staffUserRepository.save(owner);
    }

    @Transactional
    public StaffUser createStaff(UUID gymId, UUID actingStaffId, StaffAttributes attributes) {
        StaffUser actor = requireActingOwner(gymId, actingStaffId);
        Gym gym = gymRepository.findByIdAndDeletedAtIsNull(gymId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "GYM_NOT_FOUND"));

        StaffUser staff = staffUserRepository.save(newStaff(gym, attributes, StaffRole.STAFF));
        auditLogService.record(new AuditLogCommand(
                gymId,
                AuditLogService.STAFF_CREATED,
                RESOURCE_TYPE,
                staff.getId().toString(),
                actor.getId(),
                Map.of("email", staff.getEmail())
        ));
        return staff;
    }

    @Transactional(readOnly = true)
    public List<StaffUser> listStaff(UUID gymId, boolean includeDeleted) {
        return staffUserRepository.findByGym(gymId, includeDeleted);
    }

    @Transactional(readOnly = true)
    public StaffUser getStaff(UUID gymId, UUID staffId) {
        StaffUser staff = staffUserRepository.findById(staffId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "STAFF_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, staff.getGym().getId(), RESOURCE_TYPE);
        return staff;
    }

    @Transactional
    public StaffUser changeStatus(UUID gymId, UUID actingStaffId, UUID staffId, StaffStatus status) {
        StaffUser actor = requireActingOwner(gymId, actingStaffId);
        rejectSelf(actor, staffId);
        StaffUser staff = getStaff(gymId, staffId);
        if (staff.isDeleted()) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "STAFF_NOT_FOUND");
        }
        StaffStatus previous = staff.getStatus();
        if (previous == status) {
            return staff;
        }
        staff.setStatus(status);
        auditLogService.record(new AuditLogCommand(
                gymId,
                AuditLogService.STAFF_STATUS_CHANGED,
                RESOURCE_TYPE,
                staff.getId().toString(),
                actor.getId(),
                Map.of("from", previous.name(), "to", status.name())
        ));
        return staff;
    }

    @Transactional
    public void offboard(UUID gymId, UUID actingStaffId, UUID staffId) {
        StaffUser actor = requireActingOwner(gymId, actingStaffId);
        rejectSelf(actor, staffId);
        StaffUser staff = getStaff(gymId, staffId);
        if (staff.isDeleted()) {
            throw new BusinessRuleViolationException("STAFF_ALREADY_DELETED", "Staff account is already offboarded");
        }
        // members created by this account keep pointing at the tombstoned row
        staff.markDeleted(OffsetDateTime.now(clock));
        auditLogService.record(new AuditLogCommand(
                gymId,
                AuditLogService.STAFF_STATUS_CHANGED,
                RESOURCE_TYPE,
                staff.getId().toString(),
                actor.getId(),
                Map.of("to", "DELETED")
        ));
        log.info("Offboarded staff={} gym={}", staff.getId(), gymId);
    }

    @Transactional
    public StaffUser restore(UUID gymId, UUID actingStaffId, UUID staffId) {
        StaffUser actor = requireActingOwner(gymId, actingStaffId);
        StaffUser staff = getStaff(gymId, staffId);
        if (!staff.isDeleted()) {
            throw new BusinessRuleViolationException("STAFF_NOT_DELETED", "Staff account is not offboarded");
        }
        staff.clearDeleted();
        auditLogService.record(new AuditLogCommand(
                gymId,
                AuditLogService.STAFF_STATUS_CHANGED,
                RESOURCE_TYPE,
                staff.getId().toString(),
                actor.getId(),
                Map.of("to", "RESTORED")
        ));
        return staff;
    }

    private StaffUser newStaff(Gym gym, StaffAttributes attributes, StaffRole role) {
        String email = attributes.email().trim();
        if (staffUserRepository.existsByEmailIgnoreCase(email)) {
            throw new ProblemException(HttpStatus.CONFLICT, "DUPLICATE_STAFF_EMAIL", "Email is already registered");
        }
        StaffUser staff = new StaffUser();
        staff.setGym(gym);
        staff.setFullName(attributes.fullName().trim());
        staff.setEmail(email);
        staff.setPasswordHash(passwordEncoder.encode(attributes.password()));
        staff.setPhone(attributes.phone());
        staff.setRole(role);
        staff.setStatus(StaffStatus.ACTIVE);
        return staff;
    }

    private static void rejectSelf(StaffUser actor, UUID targetStaffId) {
        if (actor.getId().equals(targetStaffId)) {
            throw new BusinessRuleViolationException("STAFF_SELF_MODIFICATION", "Owners cannot change their own account status");
        }
    }

    public record StaffAttributes(String fullName, String email, String password, String phone) {
    }
}
