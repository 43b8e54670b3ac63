package com.gymledger.backend.modules.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import com.gymledger.backend.global.error.ProblemException;
import com.gymledger.backend.modules.plan.application.PlanCatalogService;
import com.gymledger.backend.modules.plan.application.PlanCatalogService.PlanAttributes;
import com.gymledger.backend.modules.plan.domain.MembershipPlan;
import com.gymledger.backend.support.AbstractPostgresIntegrationTest;
import com.gymledger.backend.support.TestTenantFactory;
import com.gymledger.backend.support.TestTenantFactory.Tenant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;

@SpringBootTest
class PlanCatalogIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private TestTenantFactory tenantFactory;

    @Autowired
    private PlanCatalogService planCatalogService;

    private Tenant tenant;

    @BeforeEach
    void setUp() {
        tenant = tenantFactory.createTenant("Nyx Gym");
    }

    @Test
    void onlyTheOwnerEditsTheCatalog() {
        PlanAttributes attributes = new PlanAttributes("Monthly", 30, new BigDecimal("250000"), null);

        assertThatThrownBy(() -> planCatalogService.createPlan(tenant.gymId(), tenant.staffId(), attributes))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("OWNER_ROLE_REQUIRED");
                });
    }

    @Test
    void durationAndPriceAreValidated() {
        assertThatThrownBy(() -> planCatalogService.createPlan(tenant.gymId(), tenant.ownerId(),
                new PlanAttributes("Broken", 0, new BigDecimal("1000"), null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_DURATION"));
        assertThatThrownBy(() -> planCatalogService.createPlan(tenant.gymId(), tenant.ownerId(),
                new PlanAttributes("Broken", 30, new BigDecimal("-5"), null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_PRICE"));
    }

    @Test
    void deactivatedPlansDropOutOfTheActiveCatalog() {
        MembershipPlan monthly = tenantFactory.createPlan(tenant, "Monthly", 30, "250000");
        tenantFactory.createPlan(tenant, "Annual", 365, "2500000");

        planCatalogService.deactivate(tenant.gymId(), tenant.ownerId(), monthly.getId());

        assertThat(planCatalogService.listPlans(tenant.gymId(), true))
                .extracting(MembershipPlan::getName)
                .containsExactly("Annual");
        assertThat(planCatalogService.listPlans(tenant.gymId(), false)).hasSize(2);

        planCatalogService.activate(tenant.gymId(), tenant.ownerId(), monthly.getId());
        assertThat(planCatalogService.listPlans(tenant.gymId(), true)).hasSize(2);
    }

    @Test
    void deletedPlanIsGone() {
        MembershipPlan monthly = tenantFactory.createPlan(tenant, "Monthly", 30, "250000");

        planCatalogService.deletePlan(tenant.gymId(), tenant.ownerId(), monthly.getId());

        assertThat(planCatalogService.listPlans(tenant.gymId(), false)).isEmpty();
        assertThatThrownBy(() -> planCatalogService.getPlan(tenant.gymId(), monthly.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("PLAN_NOT_FOUND"));
    }
}
