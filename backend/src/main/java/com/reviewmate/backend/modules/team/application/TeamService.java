package com.reviewmate.backend.modules.team.application;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.reviewmate.backend.global.error.ProblemCodes;
import com.reviewmate.backend.modules.team.domain.Team;
import com.reviewmate.backend.modules.team.infrastructure.persistence.TeamRepository;
import com.reviewmate.backend.modules.team.presentation.dto.CreateTeamRequest;
import com.reviewmate.backend.modules.team.presentation.dto.TeamMemberRequest;
import com.reviewmate.backend.modules.team.presentation.dto.TeamMemberResponse;
import com.reviewmate.backend.modules.team.presentation.dto.TeamResponse;
import com.reviewmate.backend.modules.user.domain.ReviewUser;
import com.reviewmate.backend.modules.user.infrastructure.persistence.ReviewUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TeamService {

    private static final Logger log = LoggerFactory.getLogger(TeamService.class);

    private final TeamRepository teamRepository;
    private final ReviewUserRepository reviewUserRepository;

    public TeamService(TeamRepository teamRepository, ReviewUserRepository reviewUserRepository) {
        this.teamRepository = teamRepository;
        this.reviewUserRepository = reviewUserRepository;
    }

    /**
     * Creates the team and creates or updates its members. A member who already exists is moved
     * into this team with the given name and activity flag.
     */
    public TeamResponse createTeam(CreateTeamRequest request) {
        String teamName = request.teamName();
        if (teamName == null || teamName.isBlank()) {
            throw ProblemCodes.invalid("team_name: must not be blank");
        }
        ensureUniqueMembers(request.members());
        if (teamRepository.existsById(teamName)) {
            throw ProblemCodes.teamExists(teamName);
        }

        Team team = insertTeam(teamName);
        for (TeamMemberRequest member : request.members()) {
            ReviewUser user = reviewUserRepository.findById(member.userId())
                    .orElseGet(() -> new ReviewUser(member.userId(), member.username(), team, member.isActive()));
            user.setUsername(member.username());
            user.setTeam(team);
            user.setActive(member.isActive());
            reviewUserRepository.save(user);
        }
        log.info("team created team={} members={}", teamName, request.members().size());

        List<TeamMemberResponse> members = request.members().stream()
                .map(member -> new TeamMemberResponse(member.userId(), member.username(), member.isActive()))
                .toList();
        return new TeamResponse(teamName, members);
    }

    @Transactional(readOnly = true)
    public TeamResponse getTeam(String teamName) {
        Team team = teamRepository.findById(teamName)
                .orElseThrow(() -> ProblemCodes.notFound("team", teamName));
        List<TeamMemberResponse> members = reviewUserRepository.findByTeamName(team.getName()).stream()
                .map(TeamMemberResponse::from)
                .toList();
        return new TeamResponse(team.getName(), members);
    }

    private Team insertTeam(String teamName) {
        try {
            return teamRepository.saveAndFlush(new Team(teamName));
        } catch (DataIntegrityViolationException ex) {
            // a concurrent create took the name between the check and the insert
            throw ProblemCodes.teamExists(teamName);
        }
    }

    private static void ensureUniqueMembers(List<TeamMemberRequest> members) {
        if (members == null) {
            throw ProblemCodes.invalid("members: must not be null");
        }
        Set<String> seen = new HashSet<>();
        for (TeamMemberRequest member : members) {
            if (!seen.add(member.userId())) {
                throw ProblemCodes.invalid("members: duplicate user_id " + member.userId());
            }
        }
    }
}
