package com.reviewmate.backend.modules.pullrequest.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ReassignReviewerRequest(
        @NotBlank String pullRequestId,
        @NotBlank String oldUserId
) {
}
