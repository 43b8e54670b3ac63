package com.gymledger.backend.modules.member.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gymledger.backend.modules.member.domain.RestoreOffer;

public record RestoreOfferResponse(
        String kind,
        UUID memberId,
        @JsonInclude(JsonInclude.Include.NON_NULL) MemberResponse member
) {

    public static RestoreOfferResponse from(RestoreOffer offer) {
        return new RestoreOfferResponse(
                offer.kind().name(),
                offer.memberId(),
                offer.member() != null ? MemberResponse.from(offer.member()) : null
        );
    }
}
