package com.gymledger.backend.modules.member.domain;

public enum MemberStatus {
    ACTIVE,
    INACTIVE
}
