package com.reviewmate.backend.modules.pullrequest.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.reviewmate.backend.modules.pullrequest.domain.PullRequest;
import com.reviewmate.backend.modules.pullrequest.domain.PullRequestStatus;

public record PullRequestResponse(
        String pullRequestId,
        String pullRequestName,
        String authorId,
        PullRequestStatus status,
        List<String> assignedReviewers,
        OffsetDateTime createdAt,
        OffsetDateTime mergedAt
) {

    public static PullRequestResponse from(PullRequest pullRequest) {
        return new PullRequestResponse(
                pullRequest.getId(),
                pullRequest.getTitle(),
                pullRequest.getAuthorId(),
                pullRequest.getStatus(),
                pullRequest.getReviewerIds(),
                pullRequest.getCreatedAt(),
                pullRequest.getMergedAt()
        );
    }
}
