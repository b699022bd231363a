package com.reviewmate.backend.modules.pullrequest.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.reviewmate.backend.modules.pullrequest.domain.PullRequest;
import com.reviewmate.backend.modules.pullrequest.domain.PullRequestStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PullRequestRepository extends JpaRepository<PullRequest, String> {

    /**
     * Loads the pull request with a row lock so concurrent reviewer swaps on it run one after another.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select pr from PullRequest pr where pr.id = :id")
    Optional<PullRequest> findByIdForUpdate(@Param("id") String id);

    @Query("""
            select r.pullRequest.id
              from PullRequestReviewer r
             where r.reviewer.id = :userId
               and r.pullRequest.status = com.reviewmate.backend.modules.pullrequest.domain.PullRequestStatus.OPEN
             order by r.pullRequest.id
            """)
    List<String> findOpenPullRequestIdsByReviewer(@Param("userId") String userId);

    @Query("""
            select pr
              from PullRequest pr
              join pr.reviewers r
             where r.reviewer.id = :userId
             order by pr.createdAt, pr.id
            """)
    List<PullRequest> findByReviewer(@Param("userId") String userId);

    long countByStatus(PullRequestStatus status);
}
