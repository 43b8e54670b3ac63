package com.gymledger.backend.global.error;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.springframework.http.HttpStatus;

public class DuplicateIdentityException extends ProblemException {

    private final UUID conflictingMemberId;
    private final UUID restoreCandidateId;

    public DuplicateIdentityException(String code, String detail, UUID conflictingMemberId, UUID restoreCandidateId) {
        super(HttpStatus.CONFLICT, code, detail, context(conflictingMemberId, restoreCandidateId));
        this.conflictingMemberId = conflictingMemberId;
        this.restoreCandidateId = restoreCandidateId;
    }

    public static DuplicateIdentityException liveConflict(String code, String field, UUID liveMemberId) {
        return new DuplicateIdentityException(
                code,
                "A live member already uses this " + field,
                liveMemberId,
                null
        );
    }

    public static DuplicateIdentityException restorable(String code, String field, UUID deletedMemberId) {
        return new DuplicateIdentityException(
                code,
                "A deleted member with this " + field + " can be restored instead",
                null,
                deletedMemberId
        );
    }

    public UUID getConflictingMemberId() {
        return conflictingMemberId;
    }

    public UUID getRestoreCandidateId() {
        return restoreCandidateId;
    }

    public boolean isRestorable() {
        return restoreCandidateId != null;
    }

    private static Map<String, Object> context(UUID conflictingMemberId, UUID restoreCandidateId) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (conflictingMemberId != null) {
            context.put("conflictingMemberId", conflictingMemberId);
        }
        if (restoreCandidateId != null) {
            context.put("restoreCandidateId", restoreCandidateId);
        }
        return context;
    }
}
