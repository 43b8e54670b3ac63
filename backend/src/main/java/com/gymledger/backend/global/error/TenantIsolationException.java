package com.gymledger.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Raised when a write would link rows of two different gyms. The detail never
 * carries identifiers of the foreign tenant.
 */
public class TenantIsolationException extends ProblemException {

    private final String resourceType;

    public TenantIsolationException(String resourceType) {
        super(HttpStatus.FORBIDDEN, "TENANT_ISOLATION_VIOLATION",
                resourceType + " does not belong to the current gym");
        this.resourceType = resourceType;
    }

    public String getResourceType() {
        return resourceType;
    }
}
