package com.reviewmate.backend.modules.pullrequest.application;

import java.util.List;

import com.reviewmate.backend.modules.user.domain.ReviewUser;

/**
 * Eligible replacements found by the first scope that produced any, or an empty result.
 */
public record CandidateSearchResult(CandidateScope scope, List<ReviewUser> candidates) {

    private static final CandidateSearchResult NONE = new CandidateSearchResult(null, List.of());

    public static CandidateSearchResult none() {
        return NONE;
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
