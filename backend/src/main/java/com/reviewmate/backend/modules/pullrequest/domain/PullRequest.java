package com.reviewmate.backend.modules.pullrequest.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.reviewmate.backend.global.jpa.AbstractAssignedIdEntity;
import com.reviewmate.backend.modules.user.domain.ReviewUser;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;

/**
 * A pull request and its reviewer set. Once MERGED the reviewer set and status are frozen.
 */
@Entity
@Table(name = "pull_requests")
public class PullRequest extends AbstractAssignedIdEntity<String> {

    @Id
    @Column(name = "pull_request_id", nullable = false, updatable = false, length = 255)
    private String id;

    @Column(name = "pull_request_name", nullable = false, length = 500)
    private String title;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_id", nullable = false, updatable = false)
    private ReviewUser author;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PullRequestStatus status = PullRequestStatus.OPEN;

    @Column(name = "merged_at")
    private OffsetDateTime mergedAt;

    @OneToMany(mappedBy = "pullRequest", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = true)
    @OrderBy("assignedAt ASC")
    private List<PullRequestReviewer> reviewers = new ArrayList<>();

    protected PullRequest() {
    }

    public PullRequest(String id, String title, ReviewUser author) {
        this.id = id;
        this.title = title;
        this.author = author;
    }

    @Override
    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public ReviewUser getAuthor() {
        return author;
    }

    public String getAuthorId() {
        return author.getId();
    }

    public PullRequestStatus getStatus() {
        return status;
    }

    public boolean isMerged() {
        return status.isTerminal();
    }

    public OffsetDateTime getMergedAt() {
        return mergedAt;
    }

    public List<PullRequestReviewer> getReviewers() {
        return Collections.unmodifiableList(reviewers);
    }

    public List<String> getReviewerIds() {
        return reviewers.stream()
                .map(PullRequestReviewer::getReviewerId)
                .toList();
    }

    public boolean hasReviewer(String userId) {
        return reviewers.stream().anyMatch(reviewer -> reviewer.getReviewerId().equals(userId));
    }

    /**
     * Adds reviewers not yet on the pull request, in the given order.
     */
    public void assignReviewers(Collection<ReviewUser> users, OffsetDateTime assignedAt) {
        ensureOpen();
        for (ReviewUser user : users) {
            if (!hasReviewer(user.getId())) {
                reviewers.add(new PullRequestReviewer(this, user, assignedAt));
            }
        }
    }

    /**
     * @return {@code false} when the user was not a reviewer
     */
    public boolean removeReviewer(String userId) {
        ensureOpen();
        Iterator<PullRequestReviewer> iterator = reviewers.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getReviewerId().equals(userId)) {
                iterator.remove();
                return true;
            }
        }
        return false;
    }

    public void replaceReviewer(String oldReviewerId, ReviewUser replacement, OffsetDateTime assignedAt) {
        ensureOpen();
        if (hasReviewer(replacement.getId())) {
            throw new IllegalStateException("user %s already reviews pull request %s".formatted(replacement.getId(), id));
        }
        if (!removeReviewer(oldReviewerId)) {
            throw new IllegalStateException("user %s does not review pull request %s".formatted(oldReviewerId, id));
        }
        reviewers.add(new PullRequestReviewer(this, replacement, assignedAt));
    }

    /**
     * Transitions OPEN to MERGED. A merged pull request is left untouched.
     *
     * @return {@code true} when this call performed the transition
     */
    public boolean merge(OffsetDateTime mergedAt) {
        if (isMerged()) {
            return false;
        }
        this.status = PullRequestStatus.MERGED;
        this.mergedAt = mergedAt;
        return true;
    }

    private void ensureOpen() {
        if (isMerged()) {
            throw new IllegalStateException("pull request %s is merged".formatted(id));
        }
    }
}
