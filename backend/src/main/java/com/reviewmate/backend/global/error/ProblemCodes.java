package com.reviewmate.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Error codes shared by every module, with the HTTP status each one maps to.
 */
public final class ProblemCodes {

    public static final String TEAM_EXISTS = "TEAM_EXISTS";
    public static final String PR_EXISTS = "PR_EXISTS";
    public static final String PR_MERGED = "PR_MERGED";
    public static final String NOT_ASSIGNED = "NOT_ASSIGNED";
    public static final String NO_CANDIDATE = "NO_CANDIDATE";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String VALIDATION_ERROR = "validation_error";
    public static final String INTERNAL_ERROR = "internal_error";

    private ProblemCodes() {
    }

    public static ProblemException teamExists(String teamName) {
        return new ProblemException(HttpStatus.BAD_REQUEST, TEAM_EXISTS, "team %s already exists".formatted(teamName));
    }

    public static ProblemException pullRequestExists(String pullRequestId) {
        return new ProblemException(HttpStatus.CONFLICT, PR_EXISTS, "pull request %s already exists".formatted(pullRequestId));
    }

    public static ProblemException pullRequestMerged(String pullRequestId) {
        return new ProblemException(HttpStatus.CONFLICT, PR_MERGED, "cannot modify merged pull request %s".formatted(pullRequestId));
    }

    public static ProblemException notAssigned(String pullRequestId, String userId) {
        return new ProblemException(HttpStatus.CONFLICT, NOT_ASSIGNED,
                "reviewer %s is not assigned to pull request %s".formatted(userId, pullRequestId));
    }

    public static ProblemException noCandidate(String pullRequestId) {
        return new ProblemException(HttpStatus.CONFLICT, NO_CANDIDATE,
                "no active replacement candidate for pull request %s".formatted(pullRequestId));
    }

    public static ProblemException notFound(String resource, String id) {
        return new ProblemException(HttpStatus.NOT_FOUND, NOT_FOUND, "%s %s not found".formatted(resource, id));
    }

    public static ProblemException invalid(String detail) {
        return new ProblemException(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, detail);
    }
}
