package com.reviewmate.backend.modules.team.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateTeamRequest(
        @NotBlank @Size(max = 255) String teamName,
        @NotNull List<@Valid @NotNull TeamMemberRequest> members
) {
}
