package com.reviewmate.backend.modules.pullrequest.application;

/**
 * Search scopes for a replacement reviewer, from narrowest to widest.
 */
public enum CandidateScope {
    REVIEWER_TEAM,
    AUTHOR_TEAM,
    ORGANIZATION
}
