package com.reviewmate.backend.modules.user.presentation.dto;

public record UserEnvelope(
        UserResponse user
) {
}
