package com.reviewmate.backend.modules.user.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SetIsActiveRequest(
        @NotBlank String userId,
        @NotNull @JsonProperty("is_active") Boolean isActive
) {
}
