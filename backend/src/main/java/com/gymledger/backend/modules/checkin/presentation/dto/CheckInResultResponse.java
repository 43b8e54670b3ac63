package com.gymledger.backend.modules.checkin.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gymledger.backend.modules.checkin.application.CheckInResult;

public record CheckInResultResponse(
        boolean admitted,
        String decision,
        @JsonInclude(JsonInclude.Include.NON_NULL) CheckInResponse checkIn
) {

    public static CheckInResultResponse from(CheckInResult result) {
        return new CheckInResultResponse(
                result.admitted(),
                result.decision().name(),
                result.checkIn() != null ? CheckInResponse.from(result.checkIn()) : null
        );
    }
}
