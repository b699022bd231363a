package com.reviewmate.backend.modules.stats.application;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

import com.reviewmate.backend.modules.pullrequest.domain.PullRequestStatus;
import com.reviewmate.backend.modules.pullrequest.infrastructure.persistence.PullRequestRepository;
import com.reviewmate.backend.modules.pullrequest.infrastructure.persistence.PullRequestReviewerRepository;
import com.reviewmate.backend.modules.pullrequest.infrastructure.persistence.ReviewerAssignmentCount;
import com.reviewmate.backend.modules.stats.presentation.dto.PullRequestStats;
import com.reviewmate.backend.modules.stats.presentation.dto.ReviewerStats;
import com.reviewmate.backend.modules.stats.presentation.dto.StatsResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class StatsService {

    private final PullRequestRepository pullRequestRepository;
    private final PullRequestReviewerRepository pullRequestReviewerRepository;

    public StatsService(
            PullRequestRepository pullRequestRepository,
            PullRequestReviewerRepository pullRequestReviewerRepository
    ) {
        this.pullRequestRepository = pullRequestRepository;
        this.pullRequestReviewerRepository = pullRequestReviewerRepository;
    }

    public StatsResponse getStats() {
        long total = pullRequestRepository.count();
        long open = pullRequestRepository.countByStatus(PullRequestStatus.OPEN);
        long merged = pullRequestRepository.countByStatus(PullRequestStatus.MERGED);
        double average = averageReviewers(pullRequestReviewerRepository.count(), total);

        Map<String, ReviewerStats> userStats = new LinkedHashMap<>();
        for (ReviewerAssignmentCount count : pullRequestReviewerRepository.countAssignmentsByReviewer()) {
            userStats.put(count.userId(), ReviewerStats.from(count));
        }
        return new StatsResponse(new PullRequestStats(total, open, merged, average), userStats);
    }

    static double averageReviewers(long assignments, long pullRequests) {
        if (pullRequests == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(assignments)
                .divide(BigDecimal.valueOf(pullRequests), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
