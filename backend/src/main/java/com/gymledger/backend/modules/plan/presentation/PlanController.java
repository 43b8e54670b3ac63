package com.gymledger.backend.modules.plan.presentation;

import java.util.List;
import java.util.UUID;

import com.gymledger.backend.global.security.SecurityUtils;
import com.gymledger.backend.global.security.StaffPrincipal;
import com.gymledger.backend.modules.plan.application.PlanCatalogService;
import com.gymledger.backend.modules.plan.application.PlanCatalogService.PlanAttributes;
import com.gymledger.backend.modules.plan.presentation.dto.CreatePlanRequest;
import com.gymledger.backend.modules.plan.presentation.dto.PlanResponse;
import com.gymledger.backend.modules.plan.presentation.dto.UpdatePlanRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/plans")
@Tag(name = "Plans")
public class PlanController {

    private final PlanCatalogService planCatalogService;

    public PlanController(PlanCatalogService planCatalogService) {
        this.planCatalogService = planCatalogService;
    }

    @GetMapping
    @Operation(summary = "List the plan catalog")
    public ResponseEntity<List<PlanResponse>> list(@RequestParam(name = "activeOnly", defaultValue = "false") boolean activeOnly) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(planCatalogService.listPlans(principal.gymId(), activeOnly).stream()
                .map(PlanResponse::from)
                .toList());
    }

    @GetMapping("/{planId}")
    public ResponseEntity<PlanResponse> get(@PathVariable UUID planId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(PlanResponse.from(planCatalogService.getPlan(principal.gymId(), planId)));
    }

    @PostMapping
    @Operation(summary = "Create a membership plan")
    public ResponseEntity<PlanResponse> create(@Valid @RequestBody CreatePlanRequest request) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        PlanAttributes attributes = new PlanAttributes(request.name(), request.durationDays(), request.price(), request.description());
        PlanResponse body = PlanResponse.from(planCatalogService.createPlan(principal.gymId(), principal.staffId(), attributes));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PatchMapping("/{planId}")
    @Operation(summary = "Update plan attributes; existing memberships keep their dates")
    public ResponseEntity<PlanResponse> update(@PathVariable UUID planId, @Valid @RequestBody UpdatePlanRequest request) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        PlanAttributes attributes = new PlanAttributes(request.name(), request.durationDays(), request.price(), request.description());
        return ResponseEntity.ok(PlanResponse.from(
                planCatalogService.updatePlan(principal.gymId(), principal.staffId(), planId, attributes)));
    }

    @PostMapping("/{planId}/deactivate")
    public ResponseEntity<PlanResponse> deactivate(@PathVariable UUID planId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(PlanResponse.from(planCatalogService.deactivate(principal.gymId(), principal.staffId(), planId)));
    }

    @PostMapping("/{planId}/activate")
    public ResponseEntity<PlanResponse> activate(@PathVariable UUID planId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(PlanResponse.from(planCatalogService.activate(principal.gymId(), principal.staffId(), planId)));
    }

    @DeleteMapping("/{planId}")
    public ResponseEntity<Void> delete(@PathVariable UUID planId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        planCatalogService.deletePlan(principal.gymId(), principal.staffId(), planId);
        return ResponseEntity.noContent().build();
    }
}
