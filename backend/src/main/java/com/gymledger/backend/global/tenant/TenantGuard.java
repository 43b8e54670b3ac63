package com.gymledger.backend.global.tenant;

import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gymledger.backend.global.error.TenantIsolationException;

/**
 * Write-time check of the rule that a row only ever references rows of its own gym.
 */
public final class TenantGuard {

    private static final Logger log = LoggerFactory.getLogger(TenantGuard.class);

    private TenantGuard() {
    }

    public static void requireSameTenant(UUID expectedGymId, UUID actualGymId, String resourceType) {
        Objects.requireNonNull(expectedGymId, "expectedGymId is required");
        if (!expectedGymId.equals(actualGymId)) {
            // the foreign gym id stays out of the log line as well as the response
            log.warn("[TENANT] cross-tenant reference rejected gym={} resource={}", expectedGymId, resourceType);
            throw new TenantIsolationException(resourceType);
        }
    }
}
