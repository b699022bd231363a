package com.reviewmate.backend.modules.user.domain;

import com.reviewmate.backend.global.jpa.AbstractAssignedIdEntity;
import com.reviewmate.backend.modules.team.domain.Team;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * A developer who can author pull requests and review them. Belongs to exactly one team.
 */
@Entity
@Table(name = "users")
public class ReviewUser extends AbstractAssignedIdEntity<String> {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, length = 255)
    private String id;

    @Column(name = "username", nullable = false, length = 255)
    private String username;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "team_name", nullable = false)
    private Team team;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    protected ReviewUser() {
    }

    public ReviewUser(String id, String username, Team team, boolean active) {
        this.id = id;
        this.username = username;
        this.team = team;
        this.active = active;
    }

    @Override
    public String getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public Team getTeam() {
        return team;
    }

    public void setTeam(Team team) {
        this.team = team;
    }

    public String getTeamName() {
        return team.getName();
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
