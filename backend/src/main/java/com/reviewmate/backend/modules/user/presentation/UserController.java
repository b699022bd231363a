package com.reviewmate.backend.modules.user.presentation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.reviewmate.backend.global.error.ProblemCodes;
import com.reviewmate.backend.modules.pullrequest.application.PullRequestService;
import com.reviewmate.backend.modules.pullrequest.presentation.dto.UserReviewsResponse;
import com.reviewmate.backend.modules.user.application.UserService;
import com.reviewmate.backend.modules.user.presentation.dto.SetIsActiveRequest;
import com.reviewmate.backend.modules.user.presentation.dto.UserEnvelope;

import io.swagger.v3.oas.annotations.Operation;

@RestController
@RequestMapping("/users")
public class UserController {

    private final UserService userService;
    private final PullRequestService pullRequestService;

    public UserController(UserService userService, PullRequestService pullRequestService) {
        this.userService = userService;
        this.pullRequestService = pullRequestService;
    }

    @PostMapping("/setIsActive")
    @Operation(summary = "Activate or deactivate a user", description = "Deactivation releases the user's open reviews.")
    public ResponseEntity<UserEnvelope> setIsActive(@Valid @RequestBody SetIsActiveRequest request) {
        return ResponseEntity.ok(new UserEnvelope(userService.setIsActive(request.userId(), request.isActive())));
    }

    @GetMapping("/getReview")
    @Operation(summary = "Pull requests the user reviews")
    public ResponseEntity<UserReviewsResponse> getReview(@RequestParam(name = "user_id", required = false) String userId) {
        if (userId == null || userId.isBlank()) {
            throw ProblemCodes.invalid("user_id: must not be blank");
        }
        return ResponseEntity.ok(pullRequestService.getUserReviews(userId.trim()));
    }
}
