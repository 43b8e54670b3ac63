package com.gymledger.backend.modules.member.domain;

import java.util.UUID;

/**
 * Answer to "can this phone be registered?". A restorable offer carries the most
 * recently deleted member holding the phone.
 */
public record RestoreOffer(Kind kind, UUID memberId, Member member) {

    public enum Kind {
        NONE,
        LIVE_CONFLICT,
        RESTORABLE
    }

    public static RestoreOffer none() {
        return new RestoreOffer(Kind.NONE, null, null);
    }

    public static RestoreOffer liveConflict(UUID memberId) {
        return new RestoreOffer(Kind.LIVE_CONFLICT, memberId, null);
    }

    public static RestoreOffer restorable(Member member) {
        return new RestoreOffer(Kind.RESTORABLE, member.getId(), member);
    }
}
