package com.reviewmate.backend.modules.team.presentation.dto;

public record TeamEnvelope(
        TeamResponse team
) {
}
