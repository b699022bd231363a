package com.reviewmate.backend.modules.team.presentation;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.reviewmate.backend.global.error.ProblemCodes;
import com.reviewmate.backend.modules.team.application.TeamDeactivationService;
import com.reviewmate.backend.modules.team.application.TeamService;
import com.reviewmate.backend.modules.team.presentation.dto.BulkDeactivateResponse;
import com.reviewmate.backend.modules.team.presentation.dto.CreateTeamRequest;
import com.reviewmate.backend.modules.team.presentation.dto.DeactivateTeamRequest;
import com.reviewmate.backend.modules.team.presentation.dto.TeamEnvelope;
import com.reviewmate.backend.modules.team.presentation.dto.TeamResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

@RestController
@RequestMapping("/team")
public class TeamController {

    private final TeamService teamService;
    private final TeamDeactivationService teamDeactivationService;

    public TeamController(TeamService teamService, TeamDeactivationService teamDeactivationService) {
        this.teamService = teamService;
        this.teamDeactivationService = teamDeactivationService;
    }

    @PostMapping("/add")
    @Operation(summary = "Create a team with its members")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "TEAM_EXISTS or invalid body")
    })
    public ResponseEntity<TeamEnvelope> addTeam(@Valid @RequestBody CreateTeamRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(new TeamEnvelope(teamService.createTeam(request)));
    }

    @GetMapping("/get")
    @Operation(summary = "Get a team with its members")
    public ResponseEntity<TeamResponse> getTeam(@RequestParam(name = "team_name", required = false) String teamName) {
        if (teamName == null || teamName.isBlank()) {
            throw ProblemCodes.invalid("team_name: must not be blank");
        }
        return ResponseEntity.ok(teamService.getTeam(teamName.trim()));
    }

    @PostMapping("/deactivate")
    @Operation(summary = "Deactivate every member of a team", description = "Open reviews of the deactivated members are reassigned or dropped.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Deactivated; see counts for partial failures"),
            @ApiResponse(responseCode = "404", description = "Team unknown or without members")
    })
    public ResponseEntity<BulkDeactivateResponse> deactivateTeam(@Valid @RequestBody DeactivateTeamRequest request) {
        return ResponseEntity.ok(teamDeactivationService.deactivateTeam(request.teamName().trim()));
    }
}
