package com.reviewmate.backend.modules.team.infrastructure.persistence;

import com.reviewmate.backend.modules.team.domain.Team;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TeamRepository extends JpaRepository<Team, String> {
}
