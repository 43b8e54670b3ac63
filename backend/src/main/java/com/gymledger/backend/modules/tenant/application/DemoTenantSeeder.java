package com.gymledger.backend.modules.tenant.application;

import com.gymledger.backend.modules.staff.application.StaffService.StaffAttributes;
import com.gymledger.backend.modules.staff.infrastructure.StaffUserRepository;
import com.gymledger.backend.modules.tenant.application.TenantService.GymAttributes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Onboards a demo tenant at startup for local environments.
 */
@Component
@ConditionalOnProperty(prefix = "gymledger.seed", name = "demo", havingValue = "true")
public class DemoTenantSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoTenantSeeder.class);

    static final String DEMO_GYM_NAME = "Nyx Gym";
    static final String DEMO_OWNER_EMAIL = "owner@nyxgym.com";

    private final TenantService tenantService;
    private final StaffUserRepository staffUserRepository;
    private final String ownerPassword;

    public DemoTenantSeeder(
            TenantService tenantService,
            StaffUserRepository staffUserRepository,
            @Value("${gymledger.seed.owner-password:password123}") String ownerPassword
    ) {
        this.tenantService = tenantService;
        this.staffUserRepository = staffUserRepository;
        this.ownerPassword = ownerPassword;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (staffUserRepository.existsByEmailIgnoreCase(DEMO_OWNER_EMAIL)) {
            log.info("Demo tenant already present, skipping seed");
            return;
        }
        tenantService.onboard(
                new GymAttributes(DEMO_GYM_NAME, "Jl. Sudirman No. 1, Jakarta", "+62215550100"),
                new StaffAttributes("Nyx Owner", DEMO_OWNER_EMAIL, ownerPassword, "+6281200000001")
        );
        log.info("Seeded demo tenant {}", DEMO_GYM_NAME);
    }
}
