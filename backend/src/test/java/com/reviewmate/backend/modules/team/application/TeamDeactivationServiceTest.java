package com.reviewmate.backend.modules.team.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;

import com.reviewmate.backend.global.error.ProblemCodes;
import com.reviewmate.backend.global.error.ProblemException;
import com.reviewmate.backend.modules.pullrequest.application.CascadeResult;
import com.reviewmate.backend.modules.pullrequest.application.ReviewerDeactivationCascade;
import com.reviewmate.backend.modules.team.presentation.dto.BulkDeactivateResponse;
import com.reviewmate.backend.modules.user.application.ReviewUserStatusWriter;
import com.reviewmate.backend.modules.user.infrastructure.persistence.ReviewUserRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TeamDeactivationServiceTest {

    @Mock
    private ReviewUserRepository reviewUserRepository;

    @Mock
    private ReviewUserStatusWriter statusWriter;

    @Mock
    private ReviewerDeactivationCascade deactivationCascade;

    private TeamDeactivationService teamDeactivationService;

    @BeforeEach
    void setUp() {
        teamDeactivationService = new TeamDeactivationService(reviewUserRepository, statusWriter, deactivationCascade);
    }

    @Test
    @DisplayName("a team without members fails with NOT_FOUND")
    void unknownTeam() {
        when(reviewUserRepository.countByTeamName("ghosts")).thenReturn(0L);

        assertThatThrownBy(() -> teamDeactivationService.deactivateTeam("ghosts"))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo(ProblemCodes.NOT_FOUND);
        verifyNoInteractions(statusWriter, deactivationCascade);
    }

    @Test
    @DisplayName("a team whose members are all inactive yields an empty result")
    void alreadyInactiveTeam() {
        when(reviewUserRepository.countByTeamName("backend")).thenReturn(3L);
        when(statusWriter.deactivateActiveMembers("backend")).thenReturn(List.of());

        BulkDeactivateResponse response = teamDeactivationService.deactivateTeam("backend");

        assertThat(response).isEqualTo(new BulkDeactivateResponse(List.of(), 0, 0));
        verify(deactivationCascade, never()).releaseOpenReviews(anyList());
    }

    @Test
    @DisplayName("deactivated ids and cascade counts are reported together")
    void reportsCascadeCounts() {
        when(reviewUserRepository.countByTeamName("backend")).thenReturn(3L);
        when(statusWriter.deactivateActiveMembers("backend")).thenReturn(List.of("u1", "u2"));
        when(deactivationCascade.releaseOpenReviews(List.of("u1", "u2"))).thenReturn(new CascadeResult(4, 1, false));

        BulkDeactivateResponse response = teamDeactivationService.deactivateTeam("backend");

        assertThat(response.deactivatedUsers()).containsExactly("u1", "u2");
        assertThat(response.reassignedPrs()).isEqualTo(4);
        assertThat(response.errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("a blank team name is rejected")
    void blankTeamName() {
        assertThatThrownBy(() -> teamDeactivationService.deactivateTeam("  "))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo(ProblemCodes.VALIDATION_ERROR);
        verify(reviewUserRepository, never()).countByTeamName(any());
    }
}
