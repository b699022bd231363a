package com.reviewmate.backend.modules.pullrequest.infrastructure.persistence;

public record ReviewerAssignmentCount(
        String userId,
        String username,
        Long totalAssignments,
        Long openPullRequests,
        Long mergedPullRequests
) {
}
