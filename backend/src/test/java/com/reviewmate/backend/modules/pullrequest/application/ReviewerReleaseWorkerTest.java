package com.reviewmate.backend.modules.pullrequest.application;

import static com.reviewmate.backend.support.ReviewFixtures.NOW;
import static com.reviewmate.backend.support.ReviewFixtures.active;
import static com.reviewmate.backend.support.ReviewFixtures.inactive;
import static com.reviewmate.backend.support.ReviewFixtures.openPullRequest;
import static com.reviewmate.backend.support.ReviewFixtures.team;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import com.reviewmate.backend.modules.pullrequest.domain.PullRequest;
import com.reviewmate.backend.modules.pullrequest.infrastructure.persistence.PullRequestRepository;
import com.reviewmate.backend.modules.team.domain.Team;
import com.reviewmate.backend.modules.user.domain.ReviewUser;
import com.reviewmate.backend.modules.user.infrastructure.persistence.ReviewUserRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReviewerReleaseWorkerTest {

    @Mock
    private PullRequestRepository pullRequestRepository;

    @Mock
    private ReviewUserRepository reviewUserRepository;

    private ReviewerReleaseWorker releaseWorker;

    private final Team backend = team("backend");
    private final Team frontend = team("frontend");
    private final ReviewUser author = active("author", frontend);
    private final ReviewUser alice = inactive("alice", backend);
    private final ReviewUser bob = inactive("bob", backend);

    @BeforeEach
    void setUp() {
        releaseWorker = new ReviewerReleaseWorker(
                pullRequestRepository,
                reviewUserRepository,
                new ReplacementCandidateSearch(reviewUserRepository),
                new Random(3),
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC)
        );
    }

    @Test
    @DisplayName("a deactivated reviewer is swapped for an active user of the author's team")
    void replacesFromAuthorTeam() {
        ReviewUser fiona = active("fiona", frontend);
        PullRequest pullRequest = openPullRequest("pr-1", author, alice, bob);
        when(pullRequestRepository.findByIdForUpdate("pr-1")).thenReturn(Optional.of(pullRequest));
        when(reviewUserRepository.findById("alice")).thenReturn(Optional.of(alice));
        when(reviewUserRepository.findByTeamName("backend")).thenReturn(List.of(alice, bob));
        when(reviewUserRepository.findByTeamName("frontend")).thenReturn(List.of(author, fiona));

        ReviewerReleaseOutcome outcome = releaseWorker.release("pr-1", "alice");

        assertThat(outcome).isEqualTo(ReviewerReleaseOutcome.REPLACED);
        assertThat(pullRequest.getReviewerIds()).containsExactly("bob", "fiona");
    }

    @Test
    @DisplayName("with no candidate in any scope the reviewer is removed and counted")
    void removesWithoutReplacement() {
        PullRequest pullRequest = openPullRequest("pr-1", author, alice, bob);
        when(pullRequestRepository.findByIdForUpdate("pr-1")).thenReturn(Optional.of(pullRequest));
        when(reviewUserRepository.findById("alice")).thenReturn(Optional.of(alice));
        when(reviewUserRepository.findByTeamName("backend")).thenReturn(List.of(alice, bob));
        when(reviewUserRepository.findByTeamName("frontend")).thenReturn(List.of(author));
        when(reviewUserRepository.findActiveExcludingTeams(anyCollection())).thenReturn(List.of());

        ReviewerReleaseOutcome outcome = releaseWorker.release("pr-1", "alice");

        assertThat(outcome).isEqualTo(ReviewerReleaseOutcome.REMOVED);
        assertThat(outcome.countsAsReassigned()).isTrue();
        assertThat(pullRequest.getReviewerIds()).containsExactly("bob");
    }

    @Test
    @DisplayName("a pull request merged in the meantime is skipped")
    void skipsMerged() {
        PullRequest pullRequest = openPullRequest("pr-1", author, alice);
        pullRequest.merge(NOW);
        when(pullRequestRepository.findByIdForUpdate("pr-1")).thenReturn(Optional.of(pullRequest));

        ReviewerReleaseOutcome outcome = releaseWorker.release("pr-1", "alice");

        assertThat(outcome).isEqualTo(ReviewerReleaseOutcome.SKIPPED);
        assertThat(outcome.countsAsReassigned()).isFalse();
        assertThat(pullRequest.getReviewerIds()).containsExactly("alice");
        verify(reviewUserRepository, never()).findById("alice");
    }

    @Test
    @DisplayName("a reviewer already released by an earlier step is skipped")
    void skipsWhenNoLongerReviewer() {
        PullRequest pullRequest = openPullRequest("pr-1", author, bob);
        when(pullRequestRepository.findByIdForUpdate("pr-1")).thenReturn(Optional.of(pullRequest));

        assertThat(releaseWorker.release("pr-1", "alice")).isEqualTo(ReviewerReleaseOutcome.SKIPPED);
    }
}
