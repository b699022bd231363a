package com.reviewmate.backend.modules.team.presentation.dto;

import java.util.List;

/**
 * Outcome of a team-wide deactivation. Replacements and removals without replacement both count
 * towards {@code reassignedPrs}; {@code errors} counts (pull request, reviewer) pairs that failed.
 */
public record BulkDeactivateResponse(
        List<String> deactivatedUsers,
        int reassignedPrs,
        int errors
) {
}
