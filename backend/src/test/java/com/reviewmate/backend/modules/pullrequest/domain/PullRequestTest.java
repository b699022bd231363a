package com.reviewmate.backend.modules.pullrequest.domain;

import static com.reviewmate.backend.support.ReviewFixtures.NOW;
import static com.reviewmate.backend.support.ReviewFixtures.active;
import static com.reviewmate.backend.support.ReviewFixtures.openPullRequest;
import static com.reviewmate.backend.support.ReviewFixtures.team;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import com.reviewmate.backend.modules.team.domain.Team;
import com.reviewmate.backend.modules.user.domain.ReviewUser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PullRequestTest {

    private final Team backend = team("backend");
    private final ReviewUser author = active("author", backend);
    private final ReviewUser alice = active("alice", backend);
    private final ReviewUser bob = active("bob", backend);
    private final ReviewUser carol = active("carol", backend);

    @Test
    @DisplayName("replacing a reviewer keeps the set size and drops the old reviewer")
    void replaceReviewer() {
        PullRequest pullRequest = openPullRequest("pr-1", author, alice, bob);

        pullRequest.replaceReviewer("alice", carol, NOW.plusMinutes(1));

        assertThat(pullRequest.getReviewerIds()).containsExactly("bob", "carol");
    }

    @Test
    @DisplayName("replacement must not already review the pull request")
    void replaceWithExistingReviewerFails() {
        PullRequest pullRequest = openPullRequest("pr-1", author, alice, bob);

        assertThatThrownBy(() -> pullRequest.replaceReviewer("alice", bob, NOW))
                .isInstanceOf(IllegalStateException.class);
        assertThat(pullRequest.getReviewerIds()).containsExactly("alice", "bob");
    }

    @Test
    @DisplayName("assigning the same user twice keeps one assignment")
    void assignIsIdempotentPerUser() {
        PullRequest pullRequest = openPullRequest("pr-1", author, alice);

        pullRequest.assignReviewers(List.of(alice, bob), NOW);

        assertThat(pullRequest.getReviewerIds()).containsExactly("alice", "bob");
    }

    @Test
    @DisplayName("merge is one-way and keeps the first merge time")
    void mergeIsIdempotent() {
        PullRequest pullRequest = openPullRequest("pr-1", author, alice);

        assertThat(pullRequest.merge(NOW.plusHours(1))).isTrue();
        assertThat(pullRequest.merge(NOW.plusHours(2))).isFalse();

        assertThat(pullRequest.getStatus()).isEqualTo(PullRequestStatus.MERGED);
        assertThat(pullRequest.getMergedAt()).isEqualTo(NOW.plusHours(1));
    }

    @Test
    @DisplayName("reviewers of a merged pull request are frozen")
    void mergedReviewersFrozen() {
        PullRequest pullRequest = openPullRequest("pr-1", author, alice);
        pullRequest.merge(NOW);

        assertThatThrownBy(() -> pullRequest.removeReviewer("alice")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> pullRequest.replaceReviewer("alice", bob, NOW)).isInstanceOf(IllegalStateException.class);
        assertThat(pullRequest.getReviewerIds()).containsExactly("alice");
    }
}
