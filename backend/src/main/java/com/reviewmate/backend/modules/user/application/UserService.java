package com.reviewmate.backend.modules.user.application;

import java.util.List;

import com.reviewmate.backend.global.error.ProblemCodes;
import com.reviewmate.backend.modules.pullrequest.application.CascadeResult;
import com.reviewmate.backend.modules.pullrequest.application.ReviewerDeactivationCascade;
import com.reviewmate.backend.modules.user.application.ReviewUserStatusWriter.StatusChange;
import com.reviewmate.backend.modules.user.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final ReviewUserStatusWriter statusWriter;
    private final ReviewerDeactivationCascade deactivationCascade;

    public UserService(ReviewUserStatusWriter statusWriter, ReviewerDeactivationCascade deactivationCascade) {
        this.statusWriter = statusWriter;
        this.deactivationCascade = deactivationCascade;
    }

    /**
     * Sets the activity flag. Deactivating an active user also releases them from their open reviews,
     * best effort; cascade failures are logged and do not undo the deactivation.
     */
    public UserResponse setIsActive(String userId, boolean active) {
        if (userId == null || userId.isBlank()) {
            throw ProblemCodes.invalid("user_id: must not be blank");
        }
        StatusChange change = statusWriter.updateActive(userId, active);
        if (change.deactivated()) {
            CascadeResult result = deactivationCascade.releaseOpenReviews(List.of(userId));
            log.info("user deactivated user={} reassigned={} errors={}", userId, result.reassigned(), result.errors());
        }
        return change.user();
    }
}
