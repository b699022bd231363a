package com.reviewmate.backend.modules.team.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record TeamMemberRequest(
        @NotBlank @Size(max = 255) String userId,
        @NotBlank @Size(max = 255) String username,
        @NotNull @JsonProperty("is_active") Boolean isActive
) {
}
