package com.gymledger.backend.modules.membership.application;

import com.gymledger.backend.modules.member.domain.Member;
import com.gymledger.backend.modules.membership.domain.GymAccessDecision;
import com.gymledger.backend.modules.membership.domain.Membership;

/**
 * Outcome of an access evaluation. {@code membership} is the covering row when
 * access is granted.
 */
public record AccessCheck(GymAccessDecision decision, Member member, Membership membership) {

    public boolean granted() {
        return decision.isGranted();
    }
}
