package com.gymledger.backend.modules.checkin.application;

import com.gymledger.backend.modules.checkin.domain.CheckIn;
import com.gymledger.backend.modules.membership.domain.GymAccessDecision;

/**
 * Either an admission with the persisted visit, or a rejection with its reason
 * and no row written.
 */
public record CheckInResult(boolean admitted, GymAccessDecision decision, CheckIn checkIn) {

    public static CheckInResult admitted(CheckIn checkIn) {
        return new CheckInResult(true, GymAccessDecision.GRANTED, checkIn);
    }

    public static CheckInResult rejected(GymAccessDecision reason) {
        return new CheckInResult(false, reason, null);
    }
}
