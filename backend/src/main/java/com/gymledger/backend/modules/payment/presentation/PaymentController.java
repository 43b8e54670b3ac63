package com.gymledger.backend.modules.payment.presentation;

import java.util.List;
import java.util.UUID;

import com.gymledger.backend.global.security.SecurityUtils;
import com.gymledger.backend.global.security.StaffPrincipal;
import com.gymledger.backend.modules.payment.application.LedgerService;
import com.gymledger.backend.modules.payment.application.LedgerService.PaymentCommand;
import com.gymledger.backend.modules.payment.presentation.dto.PaymentResponse;
import com.gymledger.backend.modules.payment.presentation.dto.RecordPaymentRequest;
import com.gymledger.backend.modules.payment.presentation.dto.UpdatePaymentStatusRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/payments")
@Tag(name = "Payments")
public class PaymentController {

    private final LedgerService ledgerService;

    public PaymentController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @PostMapping
    @Operation(summary = "Record a payment")
    public ResponseEntity<PaymentResponse> record(@Valid @RequestBody RecordPaymentRequest request) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        PaymentCommand command = new PaymentCommand(
                request.memberId(),
                request.membershipId(),
                request.amount(),
                request.paymentFor(),
                request.method(),
                request.status(),
                request.notes()
        );
        PaymentResponse body = PaymentResponse.from(ledgerService.recordPayment(principal.gymId(), principal.staffId(), command));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping
    @Operation(summary = "List the ledger, optionally for one member")
    public ResponseEntity<List<PaymentResponse>> list(@RequestParam(name = "memberId", required = false) UUID memberId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(ledgerService.listPayments(principal.gymId(), memberId).stream()
                .map(PaymentResponse::from)
                .toList());
    }

    @GetMapping("/{paymentId}")
    public ResponseEntity<PaymentResponse> get(@PathVariable UUID paymentId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(PaymentResponse.from(ledgerService.getPayment(principal.gymId(), paymentId)));
    }

    @PatchMapping("/{paymentId}/status")
    @Operation(summary = "Move a payment to its next status")
    public ResponseEntity<PaymentResponse> changeStatus(
            @PathVariable UUID paymentId,
            @Valid @RequestBody UpdatePaymentStatusRequest request
    ) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(PaymentResponse.from(
                ledgerService.transitionStatus(principal.gymId(), principal.staffId(), paymentId, request.status())));
    }
}
