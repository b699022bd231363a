package com.reviewmate.backend.modules.team.domain;

import com.reviewmate.backend.global.jpa.AbstractAssignedIdEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * A team is identified by its name. Members reference the team from {@code users.team_name}.
 */
@Entity
@Table(name = "teams")
public class Team extends AbstractAssignedIdEntity<String> {

    @Id
    @Column(name = "team_name", nullable = false, updatable = false, length = 255)
    private String name;

    protected Team() {
    }

    public Team(String name) {
        this.name = name;
    }

    @Override
    public String getId() {
        return name;
    }

    public String getName() {
        return name;
    }
}
