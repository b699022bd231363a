package com.reviewmate.backend.modules.pullrequest.application;

import java.util.List;

import com.reviewmate.backend.modules.pullrequest.infrastructure.persistence.PullRequestRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Walks the open reviews of freshly deactivated users and releases them one pull request at a time.
 * Failures are counted, never propagated. Runs outside any surrounding transaction so that each
 * release commits independently.
 *
 * <p>The loop stops early only when the calling thread is interrupted. A servlet container does not
 * interrupt a request thread when the client disconnects, so for HTTP callers the loop runs to the
 * end; each store call is bounded by {@code jakarta.persistence.query.timeout}.
 */
@Service
public class ReviewerDeactivationCascade {

    private static final Logger log = LoggerFactory.getLogger(ReviewerDeactivationCascade.class);

    private final PullRequestRepository pullRequestRepository;
    private final ReviewerReleaseWorker releaseWorker;

    public ReviewerDeactivationCascade(
            PullRequestRepository pullRequestRepository,
            ReviewerReleaseWorker releaseWorker
    ) {
        this.pullRequestRepository = pullRequestRepository;
        this.releaseWorker = releaseWorker;
    }

    public CascadeResult releaseOpenReviews(List<String> deactivatedUserIds) {
        int reassigned = 0;
        int errors = 0;

        users:
        for (String userId : deactivatedUserIds) {
            if (Thread.currentThread().isInterrupted()) {
                return stopped(reassigned, errors);
            }
            List<String> openPullRequestIds;
            try {
                openPullRequestIds = pullRequestRepository.findOpenPullRequestIdsByReviewer(userId);
            } catch (RuntimeException ex) {
                errors++;
                log.warn("failed to list open reviews user={} error={}", userId, ex.getMessage());
                continue;
            }

            for (String pullRequestId : openPullRequestIds) {
                if (Thread.currentThread().isInterrupted()) {
                    break users;
                }
                try {
                    if (releaseWorker.release(pullRequestId, userId).countsAsReassigned()) {
                        reassigned++;
                    }
                } catch (RuntimeException ex) {
                    errors++;
                    log.warn("failed to release reviewer pr={} user={} error={}", pullRequestId, userId, ex.getMessage());
                }
            }
        }

        if (Thread.currentThread().isInterrupted()) {
            return stopped(reassigned, errors);
        }
        return new CascadeResult(reassigned, errors, false);
    }

    private static CascadeResult stopped(int reassigned, int errors) {
        log.warn("reviewer cascade interrupted reassigned={} errors={}", reassigned, errors);
        return new CascadeResult(reassigned, errors, true);
    }
}
