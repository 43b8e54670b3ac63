package com.gymledger.backend.modules.membership.application;

public record SweepResult(int transitioned, int expired, int pendingRenewal, int autoRenewed) {
}
