package com.gymledger.backend.global.error;

import java.util.Map;

import org.springframework.http.HttpStatus;

/**
 * A recoverable refusal. {@code blockers} names the rows that have to be
 * resolved before the operation can succeed.
 */
public class BusinessRuleViolationException extends ProblemException {

    public BusinessRuleViolationException(String code, String detail) {
        super(HttpStatus.CONFLICT, code, detail, Map.of());
    }

    public BusinessRuleViolationException(String code, String detail, Map<String, Object> blockers) {
        super(HttpStatus.CONFLICT, code, detail, blockers);
    }
}
