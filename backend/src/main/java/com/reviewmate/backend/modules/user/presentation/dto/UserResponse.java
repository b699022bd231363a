package com.reviewmate.backend.modules.user.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reviewmate.backend.modules.user.domain.ReviewUser;

public record UserResponse(
        String userId,
        String username,
        String teamName,
        @JsonProperty("is_active") boolean isActive
) {

    public static UserResponse from(ReviewUser user) {
        return new UserResponse(user.getId(), user.getUsername(), user.getTeamName(), user.isActive());
    }
}
