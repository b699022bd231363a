package com.reviewmate.backend.modules.pullrequest.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record MergePullRequestRequest(
        @NotBlank String pullRequestId
) {
}
