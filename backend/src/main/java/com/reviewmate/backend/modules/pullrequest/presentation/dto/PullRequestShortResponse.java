package com.reviewmate.backend.modules.pullrequest.presentation.dto;

import com.reviewmate.backend.modules.pullrequest.domain.PullRequest;
import com.reviewmate.backend.modules.pullrequest.domain.PullRequestStatus;

public record PullRequestShortResponse(
        String pullRequestId,
        String pullRequestName,
        String authorId,
        PullRequestStatus status
) {

    public static PullRequestShortResponse from(PullRequest pullRequest) {
        return new PullRequestShortResponse(
                pullRequest.getId(),
                pullRequest.getTitle(),
                pullRequest.getAuthorId(),
                pullRequest.getStatus()
        );
    }
}
