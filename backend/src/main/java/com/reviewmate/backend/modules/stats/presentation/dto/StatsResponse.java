package com.reviewmate.backend.modules.stats.presentation.dto;

import java.util.Map;

/**
 * {@code userStats} is keyed by user id and only lists users with at least one assignment.
 */
public record StatsResponse(
        PullRequestStats prStats,
        Map<String, ReviewerStats> userStats
) {
}
