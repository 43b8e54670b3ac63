package com.gymledger.backend.modules.staff.domain;

public enum StaffRole {
    OWNER,
    STAFF
}
