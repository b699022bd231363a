package com.reviewmate.backend.modules.team.application;

import java.util.List;
import java.util.concurrent.TimeUnit;

import com.reviewmate.backend.global.error.ProblemCodes;
import com.reviewmate.backend.modules.pullrequest.application.CascadeResult;
import com.reviewmate.backend.modules.pullrequest.application.ReviewerDeactivationCascade;
import com.reviewmate.backend.modules.team.presentation.dto.BulkDeactivateResponse;
import com.reviewmate.backend.modules.user.application.ReviewUserStatusWriter;
import com.reviewmate.backend.modules.user.infrastructure.persistence.ReviewUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Deactivates a whole team, then releases each deactivated member from their open reviews.
 * <p>
 * The deactivation commits in one statement batch before any reviewer is touched. Reviewer
 * releases follow sequentially, one transaction per pull request; their failures show up only in
 * the error count. Only an unknown or empty team fails the call.
 */
@Service
public class TeamDeactivationService {

    private static final Logger log = LoggerFactory.getLogger(TeamDeactivationService.class);

    private final ReviewUserRepository reviewUserRepository;
    private final ReviewUserStatusWriter statusWriter;
    private final ReviewerDeactivationCascade deactivationCascade;

    public TeamDeactivationService(
            ReviewUserRepository reviewUserRepository,
            ReviewUserStatusWriter statusWriter,
            ReviewerDeactivationCascade deactivationCascade
    ) {
        this.reviewUserRepository = reviewUserRepository;
        this.statusWriter = statusWriter;
        this.deactivationCascade = deactivationCascade;
    }

    public BulkDeactivateResponse deactivateTeam(String teamName) {
        if (teamName == null || teamName.isBlank()) {
            throw ProblemCodes.invalid("team_name: must not be blank");
        }
        if (reviewUserRepository.countByTeamName(teamName) == 0) {
            throw ProblemCodes.notFound("team", teamName);
        }

        long startedAt = System.nanoTime();
        List<String> deactivated = statusWriter.deactivateActiveMembers(teamName);
        if (deactivated.isEmpty()) {
            log.info("team deactivation found no active members team={}", teamName);
            return new BulkDeactivateResponse(List.of(), 0, 0);
        }

        CascadeResult result = deactivationCascade.releaseOpenReviews(deactivated);
        log.info("team deactivated team={} users={} reassigned={} errors={} interrupted={} elapsedMs={}",
                teamName,
                deactivated.size(),
                result.reassigned(),
                result.errors(),
                result.interrupted(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
        return new BulkDeactivateResponse(deactivated, result.reassigned(), result.errors());
    }
}
