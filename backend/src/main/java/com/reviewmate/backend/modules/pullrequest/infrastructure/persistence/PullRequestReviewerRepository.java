package com.reviewmate.backend.modules.pullrequest.infrastructure.persistence;

import java.util.List;

import com.reviewmate.backend.modules.pullrequest.domain.PullRequestReviewer;
import com.reviewmate.backend.modules.pullrequest.domain.PullRequestReviewerId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface PullRequestReviewerRepository extends JpaRepository<PullRequestReviewer, PullRequestReviewerId> {

    @Query("""
            select new com.reviewmate.backend.modules.pullrequest.infrastructure.persistence.ReviewerAssignmentCount(
                       u.id,
                       u.username,
                       count(r),
                       sum(case when pr.status = com.reviewmate.backend.modules.pullrequest.domain.PullRequestStatus.OPEN then 1L else 0L end),
                       sum(case when pr.status = com.reviewmate.backend.modules.pullrequest.domain.PullRequestStatus.MERGED then 1L else 0L end)
                   )
              from PullRequestReviewer r
              join r.reviewer u
              join r.pullRequest pr
             group by u.id, u.username
             order by u.id
            """)
    List<ReviewerAssignmentCount> countAssignmentsByReviewer();
}
