package com.gymledger.backend.modules.report.application;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.gymledger.backend.global.error.BusinessRuleViolationException;

/**
 * Inclusive date range, evaluated in UTC.
 */
public record ReportPeriod(LocalDate from, LocalDate to) {

    public ReportPeriod {
        if (from == null || to == null) {
            throw new BusinessRuleViolationException("INVALID_PERIOD", "Both ends of the period are required");
        }
        if (to.isBefore(from)) {
            throw new BusinessRuleViolationException("INVALID_PERIOD", "Period end is before its start");
        }
    }

    public OffsetDateTime startInclusive() {
        return from.atStartOfDay().atOffset(ZoneOffset.UTC);
    }

    public OffsetDateTime endExclusive() {
        return to.plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC);
    }
}
