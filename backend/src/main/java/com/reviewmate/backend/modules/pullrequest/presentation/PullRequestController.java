package com.reviewmate.backend.modules.pullrequest.presentation;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.reviewmate.backend.modules.pullrequest.application.PullRequestService;
import com.reviewmate.backend.modules.pullrequest.presentation.dto.CreatePullRequestRequest;
import com.reviewmate.backend.modules.pullrequest.presentation.dto.MergePullRequestRequest;
import com.reviewmate.backend.modules.pullrequest.presentation.dto.PullRequestEnvelope;
import com.reviewmate.backend.modules.pullrequest.presentation.dto.ReassignReviewerRequest;
import com.reviewmate.backend.modules.pullrequest.presentation.dto.ReassignReviewerResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

@RestController
@RequestMapping("/pullRequest")
public class PullRequestController {

    private final PullRequestService pullRequestService;

    public PullRequestController(PullRequestService pullRequestService) {
        this.pullRequestService = pullRequestService;
    }

    @PostMapping("/create")
    @Operation(summary = "Create a pull request", description = "Assigns up to two active reviewers from the author's team.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "404", description = "Author not found"),
            @ApiResponse(responseCode = "409", description = "PR_EXISTS")
    })
    public ResponseEntity<PullRequestEnvelope> create(@Valid @RequestBody CreatePullRequestRequest request) {
        PullRequestEnvelope body = new PullRequestEnvelope(pullRequestService.createPullRequest(
                request.pullRequestId(),
                request.pullRequestName(),
                request.authorId()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/merge")
    @Operation(summary = "Merge a pull request", description = "Idempotent; merging twice returns the merged pull request.")
    public ResponseEntity<PullRequestEnvelope> merge(@Valid @RequestBody MergePullRequestRequest request) {
        return ResponseEntity.ok(new PullRequestEnvelope(pullRequestService.mergePullRequest(request.pullRequestId())));
    }

    @PostMapping("/reassign")
    @Operation(summary = "Replace one reviewer")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Reassigned"),
            @ApiResponse(responseCode = "404", description = "Pull request or user not found"),
            @ApiResponse(responseCode = "409", description = "PR_MERGED, NOT_ASSIGNED or NO_CANDIDATE")
    })
    public ResponseEntity<ReassignReviewerResponse> reassign(@Valid @RequestBody ReassignReviewerRequest request) {
        return ResponseEntity.ok(pullRequestService.reassignReviewer(request.pullRequestId(), request.oldUserId()));
    }
}
