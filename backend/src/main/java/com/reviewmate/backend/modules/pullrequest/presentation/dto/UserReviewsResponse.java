package com.reviewmate.backend.modules.pullrequest.presentation.dto;

import java.util.List;

public record UserReviewsResponse(
        String userId,
        List<PullRequestShortResponse> pullRequests
) {
}
