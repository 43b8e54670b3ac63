package com.gymledger.backend.modules.member.presentation.dto;

import java.util.List;

public record MemberListResponse(
        List<MemberResponse> items,
        int page,
        int size,
        long totalCount
) {
}
