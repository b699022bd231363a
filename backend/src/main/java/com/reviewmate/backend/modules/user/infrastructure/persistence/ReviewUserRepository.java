package com.reviewmate.backend.modules.user.infrastructure.persistence;

import java.util.Collection;
import java.util.List;

import com.reviewmate.backend.modules.user.domain.ReviewUser;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReviewUserRepository extends JpaRepository<ReviewUser, String> {

    @Query("""
            select u
              from ReviewUser u
             where u.team.name = :teamName
             order by u.id
            """)
    List<ReviewUser> findByTeamName(@Param("teamName") String teamName);

    @Query("select count(u) from ReviewUser u where u.team.name = :teamName")
    long countByTeamName(@Param("teamName") String teamName);

    /**
     * Active users of every team except the given ones. {@code teamNames} must not be empty.
     */
    @Query("""
            select u
              from ReviewUser u
             where u.active = true
               and u.team.name not in :teamNames
             order by u.id
            """)
    List<ReviewUser> findActiveExcludingTeams(@Param("teamNames") Collection<String> teamNames);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select u
              from ReviewUser u
             where u.team.name = :teamName
               and u.active = true
             order by u.id
            """)
    List<ReviewUser> findActiveByTeamForUpdate(@Param("teamName") String teamName);
}
