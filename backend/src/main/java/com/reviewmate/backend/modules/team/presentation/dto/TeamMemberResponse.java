package com.reviewmate.backend.modules.team.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reviewmate.backend.modules.user.domain.ReviewUser;

public record TeamMemberResponse(
        String userId,
        String username,
        @JsonProperty("is_active") boolean isActive
) {

    public static TeamMemberResponse from(ReviewUser user) {
        return new TeamMemberResponse(user.getId(), user.getUsername(), user.isActive());
    }
}
