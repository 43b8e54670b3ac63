package com.gymledger.backend.modules.staff.presentation;

import java.util.List;
import java.util.UUID;

import com.gymledger.backend.global.error.InvalidEnumValueException;
import com.gymledger.backend.global.security.SecurityUtils;
import com.gymledger.backend.global.security.StaffPrincipal;
import com.gymledger.backend.modules.staff.application.StaffService;
import com.gymledger.backend.modules.staff.application.StaffService.StaffAttributes;
import com.gymledger.backend.modules.staff.domain.StaffStatus;
import com.gymledger.backend.modules.staff.presentation.dto.CreateStaffRequest;
import com.gymledger.backend.modules.staff.presentation.dto.StaffResponse;
import com.gymledger.backend.modules.staff.presentation.dto.UpdateStaffStatusRequest;

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
@RequestMapping("/staff")
@Tag(name = "Staff")
public class StaffController {

    private final StaffService staffService;

    public StaffController(StaffService staffService) {
        this.staffService = staffService;
    }

    @GetMapping
    @Operation(summary = "List staff accounts of the gym")
    public ResponseEntity<List<StaffResponse>> list(
            @RequestParam(name = "includeDeleted", defaultValue = "false") boolean includeDeleted
    ) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        List<StaffResponse> body = staffService.listStaff(principal.gymId(), includeDeleted).stream()
                .map(StaffResponse::from)
                .toList();
        return ResponseEntity.ok(body);
    }

    @PostMapping
    @Operation(summary = "Create a staff account")
    public ResponseEntity<StaffResponse> create(@Valid @RequestBody CreateStaffRequest request) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        StaffAttributes attributes = new StaffAttributes(request.fullName(), request.email(), request.password(), request.phone());
        StaffResponse body = StaffResponse.from(staffService.createStaff(principal.gymId(), principal.staffId(), attributes));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PatchMapping("/{staffId}/status")
    @Operation(summary = "Activate or deactivate a staff account")
    public ResponseEntity<StaffResponse> changeStatus(
            @PathVariable UUID staffId,
            @Valid @RequestBody UpdateStaffStatusRequest request
    ) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        StaffStatus status = InvalidEnumValueException.parse(StaffStatus.class, "status", request.status());
        return ResponseEntity.ok(StaffResponse.from(
                staffService.changeStatus(principal.gymId(), principal.staffId(), staffId, status)));
    }

    @DeleteMapping("/{staffId}")
    @Operation(summary = "Offboard a staff account")
    public ResponseEntity<Void> offboard(@PathVariable UUID staffId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        staffService.offboard(principal.gymId(), principal.staffId(), staffId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{staffId}/restore")
    @Operation(summary = "Restore an offboarded staff account")
    public ResponseEntity<StaffResponse> restore(@PathVariable UUID staffId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(StaffResponse.from(staffService.restore(principal.gymId(), principal.staffId(), staffId)));
    }
}
