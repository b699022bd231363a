package com.reviewmate.backend.modules.user.application;

import java.util.List;

import com.reviewmate.backend.global.error.ProblemCodes;
import com.reviewmate.backend.modules.user.domain.ReviewUser;
import com.reviewmate.backend.modules.user.infrastructure.persistence.ReviewUserRepository;
import com.reviewmate.backend.modules.user.presentation.dto.UserResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes user activity flags in short transactions of their own, ahead of any reviewer cascade.
 */
@Service
@Transactional
public class ReviewUserStatusWriter {

    private final ReviewUserRepository reviewUserRepository;

    public ReviewUserStatusWriter(ReviewUserRepository reviewUserRepository) {
        this.reviewUserRepository = reviewUserRepository;
    }

    /**
     * Flips every active member of the team to inactive under row locks.
     *
     * @return ids of the members this call deactivated, in id order
     */
    public List<String> deactivateActiveMembers(String teamName) {
        List<ReviewUser> active = reviewUserRepository.findActiveByTeamForUpdate(teamName);
        active.forEach(user -> user.setActive(false));
        return active.stream().map(ReviewUser::getId).toList();
    }

    public StatusChange updateActive(String userId, boolean active) {
        ReviewUser user = reviewUserRepository.findById(userId)
                .orElseThrow(() -> ProblemCodes.notFound("user", userId));
        boolean deactivated = user.isActive() && !active;
        user.setActive(active);
        return new StatusChange(UserResponse.from(user), deactivated);
    }

    /**
     * @param deactivated {@code true} when the user went from active to inactive
     */
    public record StatusChange(UserResponse user, boolean deactivated) {
    }
}
