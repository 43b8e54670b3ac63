package com.gymledger.backend.modules.plan.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.gymledger.backend.global.error.BusinessRuleViolationException;
import com.gymledger.backend.global.error.ProblemException;
import com.gymledger.backend.global.tenant.TenantGuard;
import com.gymledger.backend.modules.plan.domain.MembershipPlan;
import com.gymledger.backend.modules.plan.infrastructure.MembershipPlanRepository;
import com.gymledger.backend.modules.staff.application.StaffService;
import com.gymledger.backend.modules.tenant.infrastructure.GymRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Plan catalog of a gym. Changing a plan never touches memberships already
 * assigned from it; their end dates were fixed at assignment.
 */
@Service
public class PlanCatalogService {

    private final MembershipPlanRepository planRepository;
    private final GymRepository gymRepository;
    private final StaffService staffService;
    private final Clock clock;

    public PlanCatalogService(
            MembershipPlanRepository planRepository,
            GymRepository gymRepository,
            StaffService staffService,
            Clock clock
    ) {
        this.planRepository = planRepository;
        this.gymRepository = gymRepository;
        this.staffService = staffService;
        this.clock = clock;
    }

    @Transactional
    public MembershipPlan createPlan(UUID gymId, UUID staffId, PlanAttributes attributes) {
        staffService.requireActingOwner(gymId, staffId);
        MembershipPlan plan = new MembershipPlan();
        plan.setGym(gymRepository.getReferenceById(gymId));
        plan.setName(requireName(attributes.name()));
        plan.setDurationDays(requireDuration(attributes.durationDays()));
        plan.setPrice(requirePrice(attributes.price()));
        plan.setDescription(attributes.description());
        plan.setActive(true);
        return planRepository.save(plan);
    }

    @Transactional
    public MembershipPlan updatePlan(UUID gymId, UUID staffId, UUID planId, PlanAttributes attributes) {
        staffService.requireActingOwner(gymId, staffId);
        MembershipPlan plan = getPlan(gymId, planId);
        if (attributes.name() != null) {
            plan.setName(requireName(attributes.name()));
        }
        if (attributes.durationDays() != null) {
            plan.setDurationDays(requireDuration(attributes.durationDays()));
        }
        if (attributes.price() != null) {
            plan.setPrice(requirePrice(attributes.price()));
        }
        if (attributes.description() != null) {
            plan.setDescription(attributes.description());
        }
        return plan;
    }

    @Transactional
    public MembershipPlan deactivate(UUID gymId, UUID staffId, UUID planId) {
        staffService.requireActingOwner(gymId, staffId);
        MembershipPlan plan = getPlan(gymId, planId);
        plan.setActive(false);
        return plan;
    }

    @Transactional
    public MembershipPlan activate(UUID gymId, UUID staffId, UUID planId) {
        staffService.requireActingOwner(gymId, staffId);
        MembershipPlan plan = getPlan(gymId, planId);
        plan.setActive(true);
        return plan;
    }

    @Transactional
    public void deletePlan(UUID gymId, UUID staffId, UUID planId) {
        staffService.requireActingOwner(gymId, staffId);
        MembershipPlan plan = getPlan(gymId, planId);
        plan.setActive(false);
        plan.markDeleted(OffsetDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public MembershipPlan getPlan(UUID gymId, UUID planId) {
        MembershipPlan plan = planRepository.findById(planId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PLAN_NOT_FOUND"));
        TenantGuard.requireSameTenant(gymId, plan.getGym().getId(), "Membership plan");
        if (plan.isDeleted()) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "PLAN_NOT_FOUND");
        }
        return plan;
    }

    @Transactional(readOnly = true)
    public List<MembershipPlan> listPlans(UUID gymId, boolean activeOnly) {
        return planRepository.findCatalog(gymId, activeOnly);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new BusinessRuleViolationException("INVALID_PLAN_NAME", "Plan name must not be blank");
        }
        return name.trim();
    }

    private static int requireDuration(Integer durationDays) {
        if (durationDays == null || durationDays <= 0) {
            throw new BusinessRuleViolationException("INVALID_DURATION", "Plan duration must be a positive number of days");
        }
        return durationDays;
    }

    private static BigDecimal requirePrice(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new BusinessRuleViolationException("INVALID_PRICE", "Plan price must be zero or more");
        }
        return price;
    }

    public record PlanAttributes(String name, Integer durationDays, BigDecimal price, String description) {
    }
}
