package com.gymledger.backend.global.security;

import java.util.UUID;

/**
 * Authenticated staff identity. Controllers read it once and pass the ids into
 * the services explicitly.
 */
public record StaffPrincipal(UUID staffId, UUID gymId, String email, String role) {

    public boolean isOwner() {
        return "OWNER".equals(role);
    }
}
