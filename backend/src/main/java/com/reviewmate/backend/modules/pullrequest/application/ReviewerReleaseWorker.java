package com.reviewmate.backend.modules.pullrequest.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.random.RandomGenerator;

import com.reviewmate.backend.global.error.ProblemCodes;
import com.reviewmate.backend.modules.pullrequest.domain.PullRequest;
import com.reviewmate.backend.modules.pullrequest.domain.ReviewerSelector;
import com.reviewmate.backend.modules.pullrequest.infrastructure.persistence.PullRequestRepository;
import com.reviewmate.backend.modules.user.domain.ReviewUser;
import com.reviewmate.backend.modules.user.infrastructure.persistence.ReviewUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Releases a deactivated reviewer from one open pull request. Each call commits on its own, so a
 * failure on one pull request leaves the others untouched.
 */
@Service
public class ReviewerReleaseWorker {

    private static final Logger log = LoggerFactory.getLogger(ReviewerReleaseWorker.class);

    private final PullRequestRepository pullRequestRepository;
    private final ReviewUserRepository reviewUserRepository;
    private final ReplacementCandidateSearch candidateSearch;
    private final RandomGenerator random;
    private final Clock clock;

    public ReviewerReleaseWorker(
            PullRequestRepository pullRequestRepository,
            ReviewUserRepository reviewUserRepository,
            ReplacementCandidateSearch candidateSearch,
            RandomGenerator random,
            Clock clock
    ) {
        this.pullRequestRepository = pullRequestRepository;
        this.reviewUserRepository = reviewUserRepository;
        this.candidateSearch = candidateSearch;
        this.random = random;
        this.clock = clock;
    }

    /**
     * Replaces the departing reviewer with a random eligible user, or removes them when no scope
     * has one. Unlike a direct reassignment, running out of candidates is not an error here.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ReviewerReleaseOutcome release(String pullRequestId, String departingUserId) {
        PullRequest pullRequest = pullRequestRepository.findByIdForUpdate(pullRequestId)
                .orElseThrow(() -> ProblemCodes.notFound("pull request", pullRequestId));
        if (pullRequest.isMerged() || !pullRequest.hasReviewer(departingUserId)) {
            return ReviewerReleaseOutcome.SKIPPED;
        }
        ReviewUser departing = reviewUserRepository.findById(departingUserId)
                .orElseThrow(() -> ProblemCodes.notFound("user", departingUserId));

        CandidateSearchResult result = candidateSearch.findReplacements(pullRequest, departing);
        if (result.isEmpty()) {
            pullRequest.removeReviewer(departingUserId);
            log.info("reviewer removed without replacement pr={} user={}", pullRequestId, departingUserId);
            return ReviewerReleaseOutcome.REMOVED;
        }

        ReviewUser replacement = ReviewerSelector.pickOne(result.candidates(), random);
        pullRequest.replaceReviewer(departingUserId, replacement, OffsetDateTime.now(clock));
        log.info("reviewer replaced pr={} old={} new={} scope={}",
                pullRequestId, departingUserId, replacement.getId(), result.scope());
        return ReviewerReleaseOutcome.REPLACED;
    }
}
