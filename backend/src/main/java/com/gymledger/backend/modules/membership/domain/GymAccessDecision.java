package com.gymledger.backend.modules.membership.domain;

public enum GymAccessDecision {
    GRANTED,
    MEMBER_DELETED,
    MEMBER_INACTIVE,
    NO_ACTIVE_MEMBERSHIP;

    public boolean isGranted() {
        return this == GRANTED;
    }
}
