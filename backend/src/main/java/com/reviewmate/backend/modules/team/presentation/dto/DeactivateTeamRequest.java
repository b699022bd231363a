package com.reviewmate.backend.modules.team.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record DeactivateTeamRequest(
        @NotBlank String teamName
) {
}
