package com.reviewmate.backend.modules.pullrequest.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePullRequestRequest(
        @NotBlank @Size(max = 255) String pullRequestId,
        @NotBlank @Size(max = 500) String pullRequestName,
        @NotBlank @Size(max = 255) String authorId
) {
}
