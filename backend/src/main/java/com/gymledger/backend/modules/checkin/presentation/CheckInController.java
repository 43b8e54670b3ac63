package com.gymledger.backend.modules.checkin.presentation;

import java.util.List;
import java.util.UUID;

import com.gymledger.backend.global.common.time.AsOfResolver;
import com.gymledger.backend.global.security.SecurityUtils;
import com.gymledger.backend.global.security.StaffPrincipal;
import com.gymledger.backend.modules.checkin.application.CheckInResult;
import com.gymledger.backend.modules.checkin.application.CheckInService;
import com.gymledger.backend.modules.checkin.presentation.dto.CheckInRequest;
import com.gymledger.backend.modules.checkin.presentation.dto.CheckInResponse;
import com.gymledger.backend.modules.checkin.presentation.dto.CheckInResultResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/check-ins")
@Tag(name = "Check-ins")
public class CheckInController {

    private final CheckInService checkInService;
    private final AsOfResolver asOfResolver;

    public CheckInController(CheckInService checkInService, AsOfResolver asOfResolver) {
        this.checkInService = checkInService;
        this.asOfResolver = asOfResolver;
    }

    @PostMapping
    @Operation(summary = "Admit a member at the desk")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Admitted and recorded"),
            @ApiResponse(responseCode = "200", description = "Rejected; decision carries the reason")
    })
    public ResponseEntity<CheckInResultResponse> checkIn(@Valid @RequestBody CheckInRequest request) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        CheckInResult result = checkInService.checkIn(
                principal.gymId(),
                request.memberId(),
                request.admittedBy(),
                asOfResolver.resolve(request.asOf())
        );
        HttpStatus status = result.admitted() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(CheckInResultResponse.from(result));
    }

    @GetMapping
    public ResponseEntity<List<CheckInResponse>> list(@RequestParam("memberId") UUID memberId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(checkInService.listCheckIns(principal.gymId(), memberId).stream()
                .map(CheckInResponse::from)
                .toList());
    }

    @DeleteMapping("/{checkInId}")
    @Operation(summary = "Void an erroneous check-in")
    public ResponseEntity<Void> voidCheckIn(@PathVariable UUID checkInId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        checkInService.voidCheckIn(principal.gymId(), principal.staffId(), checkInId);
        return ResponseEntity.noContent().build();
    }
}
