package com.gymledger.backend.modules.tenant.application;

import java.util.UUID;

import com.gymledger.backend.global.error.ProblemException;
import com.gymledger.backend.modules.staff.application.StaffService;
import com.gymledger.backend.modules.staff.application.StaffService.StaffAttributes;
import com.gymledger.backend.modules.staff.domain.StaffUser;
import com.gymledger.backend.modules.tenant.domain.Gym;
import com.gymledger.backend.modules.tenant.infrastructure.GymRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TenantService {

    private static final Logger log = LoggerFactory.getLogger(TenantService.class);

    private final GymRepository gymRepository;
    private final StaffService staffService;

    public TenantService(GymRepository gymRepository, StaffService staffService) {
        this.gymRepository = gymRepository;
        this.staffService = staffService;
    }

    @Transactional
    public Gym createTenant(GymAttributes attributes) {
        Gym gym = new Gym();
        gym.setName(requireName(attributes.name()));
        gym.setAddress(trimToNull(attributes.address()));
        gym.setPhone(trimToNull(attributes.phone()));
        return gymRepository.save(gym);
    }

    @Transactional(readOnly = true)
    public Gym getTenant(UUID gymId) {
        return gymRepository.findByIdAndDeletedAtIsNull(gymId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "GYM_NOT_FOUND"));
    }

    /**
     * Creates the gym and its first OWNER in one unit of work; either both rows
     * exist afterwards or neither does.
     */
    @Transactional
    public OnboardingResult onboard(GymAttributes gymAttributes, StaffAttributes ownerAttributes) {
        Gym gym = createTenant(gymAttributes);
        StaffUser owner = staffService.createOwner(gym, ownerAttributes);
        log.info("Onboarded gym={} owner={}", gym.getId(), owner.getId());
        return new OnboardingResult(gym, owner);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "GYM_NAME_REQUIRED");
        }
        return name.trim();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public record GymAttributes(String name, String address, String phone) {
    }

    public record OnboardingResult(Gym gym, StaffUser owner) {
    }
}
