package com.reviewmate.backend.modules.stats.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.List;

import com.reviewmate.backend.modules.pullrequest.domain.PullRequestStatus;
import com.reviewmate.backend.modules.pullrequest.infrastructure.persistence.PullRequestRepository;
import com.reviewmate.backend.modules.pullrequest.infrastructure.persistence.PullRequestReviewerRepository;
import com.reviewmate.backend.modules.pullrequest.infrastructure.persistence.ReviewerAssignmentCount;
import com.reviewmate.backend.modules.stats.presentation.dto.PullRequestStats;
import com.reviewmate.backend.modules.stats.presentation.dto.ReviewerStats;
import com.reviewmate.backend.modules.stats.presentation.dto.StatsResponse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StatsServiceTest {

    @Mock
    private PullRequestRepository pullRequestRepository;

    @Mock
    private PullRequestReviewerRepository pullRequestReviewerRepository;

    @InjectMocks
    private StatsService statsService;

    @Test
    @DisplayName("counts and per-reviewer assignments are aggregated")
    void aggregates() {
        when(pullRequestRepository.count()).thenReturn(3L);
        when(pullRequestRepository.countByStatus(PullRequestStatus.OPEN)).thenReturn(2L);
        when(pullRequestRepository.countByStatus(PullRequestStatus.MERGED)).thenReturn(1L);
        when(pullRequestReviewerRepository.count()).thenReturn(5L);
        when(pullRequestReviewerRepository.countAssignmentsByReviewer()).thenReturn(List.of(
                new ReviewerAssignmentCount("u1", "Uma", 3L, 2L, 1L),
                new ReviewerAssignmentCount("u2", "Ugo", 2L, 2L, 0L)
        ));

        StatsResponse stats = statsService.getStats();

        assertThat(stats.prStats()).isEqualTo(new PullRequestStats(3, 2, 1, 1.67));
        assertThat(stats.userStats()).containsOnlyKeys("u1", "u2");
        assertThat(stats.userStats().get("u1")).isEqualTo(new ReviewerStats("u1", "Uma", 3, 2, 1));
    }

    @Test
    @DisplayName("the average is zero without pull requests")
    void averageWithoutPullRequests() {
        assertThat(StatsService.averageReviewers(0, 0)).isZero();
        assertThat(StatsService.averageReviewers(4, 2)).isEqualTo(2.0);
    }
}
