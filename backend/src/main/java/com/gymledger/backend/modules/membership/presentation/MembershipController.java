package com.gymledger.backend.modules.membership.presentation;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.gymledger.backend.global.common.time.AsOfResolver;
import com.gymledger.backend.global.security.SecurityUtils;
import com.gymledger.backend.global.security.StaffPrincipal;
import com.gymledger.backend.modules.membership.application.MembershipService;
import com.gymledger.backend.modules.membership.application.MembershipService.AssignmentCommand;
import com.gymledger.backend.modules.membership.presentation.dto.AccessResponse;
import com.gymledger.backend.modules.membership.presentation.dto.AssignMembershipRequest;
import com.gymledger.backend.modules.membership.presentation.dto.MembershipResponse;
import com.gymledger.backend.modules.membership.presentation.dto.StatusSweepResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Memberships")
public class MembershipController {

    private final MembershipService membershipService;
    private final AsOfResolver asOfResolver;

    public MembershipController(MembershipService membershipService, AsOfResolver asOfResolver) {
        this.membershipService = membershipService;
        this.asOfResolver = asOfResolver;
    }

    @PostMapping("/memberships")
    @Operation(summary = "Assign a plan to a member")
    public ResponseEntity<MembershipResponse> assign(@Valid @RequestBody AssignMembershipRequest request) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        AssignmentCommand command = new AssignmentCommand(
                request.memberId(),
                request.planId(),
                request.startDate(),
                request.autoRenew(),
                request.overrideInactive()
        );
        MembershipResponse body = MembershipResponse.from(membershipService.assign(principal.gymId(), principal.staffId(), command));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping("/memberships")
    public ResponseEntity<List<MembershipResponse>> list(@RequestParam("memberId") UUID memberId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(membershipService.listMemberships(principal.gymId(), memberId).stream()
                .map(MembershipResponse::from)
                .toList());
    }

    @GetMapping("/memberships/{membershipId}")
    public ResponseEntity<MembershipResponse> get(@PathVariable UUID membershipId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(MembershipResponse.from(membershipService.getMembership(principal.gymId(), membershipId)));
    }

    @PostMapping("/memberships/{membershipId}/cancel")
    @Operation(summary = "Cancel an active or pending-renewal membership")
    public ResponseEntity<MembershipResponse> cancel(@PathVariable UUID membershipId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(MembershipResponse.from(
                membershipService.cancel(principal.gymId(), principal.staffId(), membershipId)));
    }

    @PostMapping("/memberships/{membershipId}/renew")
    @Operation(summary = "Renew a membership; returns the successor period")
    public ResponseEntity<MembershipResponse> renew(
            @PathVariable UUID membershipId,
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        LocalDate effective = asOfResolver.resolveDate(asOf);
        MembershipResponse body = MembershipResponse.from(
                membershipService.renew(principal.gymId(), principal.staffId(), membershipId, effective));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/memberships/status-sweep")
    @Operation(summary = "Recompute membership statuses of the gym as of a date")
    public ResponseEntity<StatusSweepResponse> sweep(
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        LocalDate effective = asOfResolver.resolveDate(asOf);
        return ResponseEntity.ok(StatusSweepResponse.from(
                effective, membershipService.recomputeStatuses(principal.gymId(), effective)));
    }

    @GetMapping("/members/{memberId}/access")
    @Operation(summary = "Whether the member may enter the gym")
    public ResponseEntity<AccessResponse> access(
            @PathVariable UUID memberId,
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime asOf
    ) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        OffsetDateTime effective = asOfResolver.resolve(asOf);
        return ResponseEntity.ok(AccessResponse.from(
                memberId, membershipService.decideAccess(principal.gymId(), memberId, effective), effective));
    }
}
