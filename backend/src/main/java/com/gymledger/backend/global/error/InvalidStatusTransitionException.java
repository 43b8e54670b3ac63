package com.gymledger.backend.global.error;

import java.util.Map;

import org.springframework.http.HttpStatus;

public class InvalidStatusTransitionException extends ProblemException {

    public InvalidStatusTransitionException(String resourceType, Enum<?> from, Enum<?> to) {
        super(
                HttpStatus.CONFLICT,
                "INVALID_STATUS_TRANSITION",
                resourceType + " cannot move from " + from + " to " + to,
                Map.of("from", from.name(), "to", to.name())
        );
    }
}
