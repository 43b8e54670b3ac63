package com.gymledger.backend.modules.tenant.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymledger.backend.modules.tenant.domain.Gym;

public record GymResponse(
        UUID id,
        String name,
        String address,
        String phone,
        OffsetDateTime createdAt
) {

    public static GymResponse from(Gym gym) {
        return new GymResponse(gym.getId(), gym.getName(), gym.getAddress(), gym.getPhone(), gym.getCreatedAt());
    }
}
