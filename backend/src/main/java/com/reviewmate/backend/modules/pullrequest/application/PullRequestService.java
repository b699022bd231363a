package com.reviewmate.backend.modules.pullrequest.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;
import java.util.random.RandomGenerator;

import com.reviewmate.backend.global.error.ProblemCodes;
import com.reviewmate.backend.modules.pullrequest.domain.PullRequest;
import com.reviewmate.backend.modules.pullrequest.domain.ReviewerSelector;
import com.reviewmate.backend.modules.pullrequest.infrastructure.persistence.PullRequestRepository;
import com.reviewmate.backend.modules.pullrequest.presentation.dto.PullRequestResponse;
import com.reviewmate.backend.modules.pullrequest.presentation.dto.PullRequestShortResponse;
import com.reviewmate.backend.modules.pullrequest.presentation.dto.ReassignReviewerResponse;
import com.reviewmate.backend.modules.pullrequest.presentation.dto.UserReviewsResponse;
import com.reviewmate.backend.modules.user.domain.ReviewUser;
import com.reviewmate.backend.modules.user.infrastructure.persistence.ReviewUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PullRequestService {

    private static final Logger log = LoggerFactory.getLogger(PullRequestService.class);

    private final PullRequestRepository pullRequestRepository;
    private final ReviewUserRepository reviewUserRepository;
    private final ReplacementCandidateSearch candidateSearch;
    private final RandomGenerator random;
    private final Clock clock;
    private final int initialReviewers;

    public PullRequestService(
            PullRequestRepository pullRequestRepository,
            ReviewUserRepository reviewUserRepository,
            ReplacementCandidateSearch candidateSearch,
            RandomGenerator random,
            Clock clock,
            @Value("${app.review.initial-reviewers:2}") int initialReviewers
    ) {
        this.pullRequestRepository = pullRequestRepository;
        this.reviewUserRepository = reviewUserRepository;
        this.candidateSearch = candidateSearch;
        this.random = random;
        this.clock = clock;
        this.initialReviewers = initialReviewers;
    }

    /**
     * Creates an OPEN pull request and assigns up to the configured number of active reviewers
     * from the author's team. Creation and assignment commit together.
     */
    public PullRequestResponse createPullRequest(String pullRequestId, String title, String authorId) {
        requireText(pullRequestId, "pull_request_id");
        requireText(title, "pull_request_name");
        requireText(authorId, "author_id");

        if (pullRequestRepository.existsById(pullRequestId)) {
            throw ProblemCodes.pullRequestExists(pullRequestId);
        }
        ReviewUser author = reviewUserRepository.findById(authorId)
                .orElseThrow(() -> ProblemCodes.notFound("user", authorId));

        OffsetDateTime now = OffsetDateTime.now(clock);
        PullRequest pullRequest = new PullRequest(pullRequestId, title, author);
        try {
            pullRequestRepository.saveAndFlush(pullRequest);
        } catch (DataIntegrityViolationException ex) {
            // lost a race against a concurrent create with the same id
            throw ProblemCodes.pullRequestExists(pullRequestId);
        }

        List<ReviewUser> teamMembers = reviewUserRepository.findByTeamName(author.getTeamName());
        List<ReviewUser> reviewers = ReviewerSelector.select(teamMembers, Set.of(authorId), initialReviewers, random);
        if (!reviewers.isEmpty()) {
            pullRequest.assignReviewers(reviewers, now);
        }

        log.info("PR created pr={} author={} reviewers={}", pullRequestId, authorId, pullRequest.getReviewerIds());
        return PullRequestResponse.from(pullRequest);
    }

    /**
     * Idempotent: merging a merged pull request returns it unchanged.
     */
    public PullRequestResponse mergePullRequest(String pullRequestId) {
        requireText(pullRequestId, "pull_request_id");
        PullRequest pullRequest = findForUpdate(pullRequestId);
        if (pullRequest.merge(OffsetDateTime.now(clock))) {
            log.info("PR merged pr={}", pullRequestId);
        } else {
            log.debug("PR already merged pr={}", pullRequestId);
        }
        return PullRequestResponse.from(pullRequest);
    }

    /**
     * Replaces one reviewer with a random eligible user. Fails with NO_CANDIDATE when no scope
     * yields a replacement; the reviewer stays assigned in that case.
     */
    public ReassignReviewerResponse reassignReviewer(String pullRequestId, String oldReviewerId) {
        requireText(pullRequestId, "pull_request_id");
        requireText(oldReviewerId, "old_user_id");

        PullRequest pullRequest = findForUpdate(pullRequestId);
        if (pullRequest.isMerged()) {
            throw ProblemCodes.pullRequestMerged(pullRequestId);
        }
        if (!pullRequest.hasReviewer(oldReviewerId)) {
            throw ProblemCodes.notAssigned(pullRequestId, oldReviewerId);
        }
        ReviewUser oldReviewer = reviewUserRepository.findById(oldReviewerId)
                .orElseThrow(() -> ProblemCodes.notFound("user", oldReviewerId));

        CandidateSearchResult result = candidateSearch.findReplacements(pullRequest, oldReviewer);
        if (result.isEmpty()) {
            throw ProblemCodes.noCandidate(pullRequestId);
        }
        ReviewUser replacement = ReviewerSelector.pickOne(result.candidates(), random);
        pullRequest.replaceReviewer(oldReviewerId, replacement, OffsetDateTime.now(clock));

        log.info("PR reviewer reassigned pr={} old={} new={} scope={}",
                pullRequestId, oldReviewerId, replacement.getId(), result.scope());
        return new ReassignReviewerResponse(PullRequestResponse.from(pullRequest), replacement.getId());
    }

    /**
     * Pull requests of any status the user reviews. Unknown users get an empty list.
     */
    @Transactional(readOnly = true)
    public UserReviewsResponse getUserReviews(String userId) {
        requireText(userId, "user_id");
        if (!reviewUserRepository.existsById(userId)) {
            return new UserReviewsResponse(userId, List.of());
        }
        List<PullRequestShortResponse> pullRequests = pullRequestRepository.findByReviewer(userId).stream()
                .map(PullRequestShortResponse::from)
                .toList();
        return new UserReviewsResponse(userId, pullRequests);
    }

    private PullRequest findForUpdate(String pullRequestId) {
        return pullRequestRepository.findByIdForUpdate(pullRequestId)
                .orElseThrow(() -> ProblemCodes.notFound("pull request", pullRequestId));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw ProblemCodes.invalid(field + ": must not be blank");
        }
    }
}
