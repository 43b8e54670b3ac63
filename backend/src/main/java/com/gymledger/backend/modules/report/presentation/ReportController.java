package com.gymledger.backend.modules.report.presentation;

import java.time.LocalDate;

import com.gymledger.backend.global.security.SecurityUtils;
import com.gymledger.backend.modules.report.application.ReportPeriod;
import com.gymledger.backend.modules.report.application.ReportService;
import com.gymledger.backend.modules.report.application.ReportService.AttendanceReport;
import com.gymledger.backend.modules.report.application.ReportService.ChurnReport;
import com.gymledger.backend.modules.report.application.ReportService.RevenueReport;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/reports")
@Tag(name = "Reports")
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/revenue")
    @Operation(summary = "Paid and refunded totals by purpose")
    public ResponseEntity<RevenueReport> revenue(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(reportService.revenue(SecurityUtils.getCurrentPrincipal().gymId(), new ReportPeriod(from, to)));
    }

    @GetMapping("/attendance")
    @Operation(summary = "Visits and distinct visiting members")
    public ResponseEntity<AttendanceReport> attendance(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(reportService.attendance(SecurityUtils.getCurrentPrincipal().gymId(), new ReportPeriod(from, to)));
    }

    @GetMapping("/churn")
    @Operation(summary = "Memberships started, expired and cancelled")
    public ResponseEntity<ChurnReport> churn(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(reportService.membershipChurn(SecurityUtils.getCurrentPrincipal().gymId(), new ReportPeriod(from, to)));
    }
}
