package com.reviewmate.backend.modules.team.presentation.dto;

import java.util.List;

public record TeamResponse(
        String teamName,
        List<TeamMemberResponse> members
) {
}
