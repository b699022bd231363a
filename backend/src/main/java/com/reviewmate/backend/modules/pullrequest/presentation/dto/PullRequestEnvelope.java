package com.reviewmate.backend.modules.pullrequest.presentation.dto;

public record PullRequestEnvelope(
        PullRequestResponse pr
) {
}
