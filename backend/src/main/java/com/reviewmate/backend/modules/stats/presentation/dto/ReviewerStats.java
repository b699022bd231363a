package com.reviewmate.backend.modules.stats.presentation.dto;

import com.reviewmate.backend.modules.pullrequest.infrastructure.persistence.ReviewerAssignmentCount;

public record ReviewerStats(
        String userId,
        String username,
        long totalAssignments,
        long openPrs,
        long mergedPrs
) {

    public static ReviewerStats from(ReviewerAssignmentCount count) {
        return new ReviewerStats(
                count.userId(),
                count.username(),
                valueOf(count.totalAssignments()),
                valueOf(count.openPullRequests()),
                valueOf(count.mergedPullRequests())
        );
    }

    private static long valueOf(Long value) {
        return value == null ? 0L : value;
    }
}
