package com.gymledger.backend.modules.membership.presentation.dto;

import java.time.LocalDate;

import com.gymledger.backend.modules.membership.application.SweepResult;

public record StatusSweepResponse(
        LocalDate asOf,
        int transitioned,
        int expired,
        int pendingRenewal,
        int autoRenewed
) {

    public static StatusSweepResponse from(LocalDate asOf, SweepResult result) {
        return new StatusSweepResponse(
                asOf,
                result.transitioned(),
                result.expired(),
                result.pendingRenewal(),
                result.autoRenewed()
        );
    }
}
