package com.reviewmate.backend.modules.pullrequest.application;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import com.reviewmate.backend.modules.pullrequest.domain.PullRequest;
import com.reviewmate.backend.modules.pullrequest.domain.ReviewerSelector;
import com.reviewmate.backend.modules.user.domain.ReviewUser;
import com.reviewmate.backend.modules.user.infrastructure.persistence.ReviewUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds replacement reviewers for a departing reviewer by widening the search scope step by step:
 * the departing reviewer's team, then the author's team when it differs, then every active user
 * outside the teams already searched. Each scope's pool is loaded only if the previous ones
 * produced no eligible user.
 */
@Component
public class ReplacementCandidateSearch {

    private static final Logger log = LoggerFactory.getLogger(ReplacementCandidateSearch.class);

    private final ReviewUserRepository reviewUserRepository;

    public ReplacementCandidateSearch(ReviewUserRepository reviewUserRepository) {
        this.reviewUserRepository = reviewUserRepository;
    }

    public CandidateSearchResult findReplacements(PullRequest pullRequest, ReviewUser departing) {
        Set<String> excluded = new HashSet<>(pullRequest.getReviewerIds());
        excluded.add(pullRequest.getAuthorId());
        excluded.add(departing.getId());

        for (CandidateTier tier : tiersFor(pullRequest, departing)) {
            List<ReviewUser> candidates = ReviewerSelector.eligible(tier.pool().get(), excluded);
            if (!candidates.isEmpty()) {
                log.debug("pr={} departing={} scope={} candidates={}",
                        pullRequest.getId(), departing.getId(), tier.scope(), candidates.size());
                return new CandidateSearchResult(tier.scope(), candidates);
            }
        }
        return CandidateSearchResult.none();
    }

    private List<CandidateTier> tiersFor(PullRequest pullRequest, ReviewUser departing) {
        String reviewerTeam = departing.getTeamName();
        String authorTeam = pullRequest.getAuthor().getTeamName();
        Set<String> searchedTeams = new LinkedHashSet<>();
        List<CandidateTier> tiers = new ArrayList<>(3);

        searchedTeams.add(reviewerTeam);
        tiers.add(new CandidateTier(CandidateScope.REVIEWER_TEAM,
                () -> reviewUserRepository.findByTeamName(reviewerTeam)));

        if (!reviewerTeam.equals(authorTeam)) {
            searchedTeams.add(authorTeam);
            tiers.add(new CandidateTier(CandidateScope.AUTHOR_TEAM,
                    () -> reviewUserRepository.findByTeamName(authorTeam)));
        }

        Set<String> excludedTeams = Set.copyOf(searchedTeams);
        tiers.add(new CandidateTier(CandidateScope.ORGANIZATION,
                () -> reviewUserRepository.findActiveExcludingTeams(excludedTeams)));
        return tiers;
    }

    private record CandidateTier(CandidateScope scope, Supplier<List<ReviewUser>> pool) {
    }
}
