package com.gymledger.backend.global.error;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;

public class InvalidEnumValueException extends ProblemException {

    public InvalidEnumValueException(String field, String rawValue, Enum<?>[] allowed) {
        super(
                HttpStatus.BAD_REQUEST,
                "INVALID_ENUM_VALUE",
                "Unsupported " + field + ": " + rawValue,
                Map.of("field", field, "allowed", names(allowed))
        );
    }

    private static List<String> names(Enum<?>[] allowed) {
        return Arrays.stream(allowed).map(Enum::name).toList();
    }

    /**
     * Strict, case-insensitive lookup; blanks and unknown names are rejected, never coerced.
     */
    public static <E extends Enum<E>> E parse(Class<E> type, String field, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new InvalidEnumValueException(field, String.valueOf(rawValue), type.getEnumConstants());
        }
        String normalized = rawValue.trim().toUpperCase();
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return constant;
            }
        }
        throw new InvalidEnumValueException(field, rawValue, type.getEnumConstants());
    }
}
