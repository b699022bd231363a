package com.reviewmate.backend.modules.pullrequest.domain;

import java.time.OffsetDateTime;

import com.reviewmate.backend.modules.user.domain.ReviewUser;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MapsId;
import jakarta.persistence.Table;

/**
 * One reviewer assignment. The (pull request, user) pair is the primary key.
 */
@Entity
@Table(name = "pr_reviewers")
public class PullRequestReviewer {

    @EmbeddedId
    private PullRequestReviewerId id;

    @MapsId("pullRequestId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "pull_request_id", nullable = false)
    private PullRequest pullRequest;

    @MapsId("userId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private ReviewUser reviewer;

    @Column(name = "assigned_at", nullable = false)
    private OffsetDateTime assignedAt;

    protected PullRequestReviewer() {
    }

    PullRequestReviewer(PullRequest pullRequest, ReviewUser reviewer, OffsetDateTime assignedAt) {
        this.id = new PullRequestReviewerId(pullRequest.getId(), reviewer.getId());
        this.pullRequest = pullRequest;
        this.reviewer = reviewer;
        this.assignedAt = assignedAt;
    }

    public PullRequestReviewerId getId() {
        return id;
    }

    public PullRequest getPullRequest() {
        return pullRequest;
    }

    public ReviewUser getReviewer() {
        return reviewer;
    }

    public String getReviewerId() {
        return id.getUserId();
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }
}
