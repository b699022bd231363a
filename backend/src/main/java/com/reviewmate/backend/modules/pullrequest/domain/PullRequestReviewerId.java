package com.reviewmate.backend.modules.pullrequest.domain;

import java.io.Serializable;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class PullRequestReviewerId implements Serializable {

    @Column(name = "pull_request_id", nullable = false, length = 255)
    private String pullRequestId;

    @Column(name = "user_id", nullable = false, length = 255)
    private String userId;

    protected PullRequestReviewerId() {
    }

    public PullRequestReviewerId(String pullRequestId, String userId) {
        this.pullRequestId = pullRequestId;
        this.userId = userId;
    }

    public String getPullRequestId() {
        return pullRequestId;
    }

    public String getUserId() {
        return userId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PullRequestReviewerId that)) return false;
        return Objects.equals(pullRequestId, that.pullRequestId) && Objects.equals(userId, that.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pullRequestId, userId);
    }
}
