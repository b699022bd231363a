package com.reviewmate.backend.modules.stats.presentation.dto;

public record PullRequestStats(
        long totalPrs,
        long openPrs,
        long mergedPrs,
        double avgReviewersPerPr
) {
}
