package com.gymledger.backend.modules.membership.domain;

import java.util.EnumSet;
import java.util.Set;

public enum MembershipStatus {
    ACTIVE,
    PENDING_RENEWAL,
    EXPIRED,
    CANCELLED;

    public boolean isTerminal() {
        return this == EXPIRED || this == CANCELLED;
    }

    public boolean grantsAccess() {
        return this == ACTIVE || this == PENDING_RENEWAL;
    }

    public boolean canTransitionTo(MembershipStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<MembershipStatus> allowedTargets() {
        return switch (this) {
            case ACTIVE -> EnumSet.of(PENDING_RENEWAL, EXPIRED, CANCELLED);
            case PENDING_RENEWAL -> EnumSet.of(ACTIVE, EXPIRED, CANCELLED);
            case EXPIRED, CANCELLED -> EnumSet.noneOf(MembershipStatus.class);
        };
    }

    public static Set<MembershipStatus> accessGranting() {
        return EnumSet.of(ACTIVE, PENDING_RENEWAL);
    }
}
