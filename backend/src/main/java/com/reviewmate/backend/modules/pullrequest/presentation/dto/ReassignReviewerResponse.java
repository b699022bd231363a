package com.reviewmate.backend.modules.pullrequest.presentation.dto;

public record ReassignReviewerResponse(
        PullRequestResponse pr,
        String replacedBy
) {
}
