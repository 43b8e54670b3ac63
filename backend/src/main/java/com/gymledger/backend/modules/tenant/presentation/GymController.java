package com.gymledger.backend.modules.tenant.presentation;

import com.gymledger.backend.global.security.SecurityUtils;
import com.gymledger.backend.modules.staff.application.StaffService.StaffAttributes;
import com.gymledger.backend.modules.staff.presentation.dto.StaffResponse;
import com.gymledger.backend.modules.tenant.application.TenantService;
import com.gymledger.backend.modules.tenant.application.TenantService.GymAttributes;
import com.gymledger.backend.modules.tenant.application.TenantService.OnboardingResult;
import com.gymledger.backend.modules.tenant.presentation.dto.GymResponse;
import com.gymledger.backend.modules.tenant.presentation.dto.OnboardGymRequest;
import com.gymledger.backend.modules.tenant.presentation.dto.OnboardGymResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/gyms")
@Tag(name = "Gyms")
public class GymController {

    private final TenantService tenantService;

    public GymController(TenantService tenantService) {
        this.tenantService = tenantService;
    }

    @PostMapping
    @Operation(summary = "Onboard a gym together with its owner account")
    public ResponseEntity<OnboardGymResponse> onboard(@Valid @RequestBody OnboardGymRequest request) {
        OnboardingResult result = tenantService.onboard(
                new GymAttributes(request.name(), request.address(), request.phone()),
                new StaffAttributes(
                        request.owner().fullName(),
                        request.owner().email(),
                        request.owner().password(),
                        request.owner().phone()
                )
        );
        OnboardGymResponse body = new OnboardGymResponse(
                GymResponse.from(result.gym()),
                StaffResponse.from(result.owner())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping("/current")
    @Operation(summary = "Gym of the signed-in staff member")
    public ResponseEntity<GymResponse> current() {
        return ResponseEntity.ok(GymResponse.from(tenantService.getTenant(SecurityUtils.getCurrentPrincipal().gymId())));
    }
}
