package com.gymledger.backend.modules.staff.domain;

public enum StaffStatus {
    ACTIVE,
    INACTIVE
}
