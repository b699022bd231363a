package com.reviewmate.backend.modules.pullrequest.application;

import static com.reviewmate.backend.support.ReviewFixtures.active;
import static com.reviewmate.backend.support.ReviewFixtures.openPullRequest;
import static com.reviewmate.backend.support.ReviewFixtures.team;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.reviewmate.backend.modules.pullrequest.domain.PullRequest;
import com.reviewmate.backend.modules.team.domain.Team;
import com.reviewmate.backend.modules.user.domain.ReviewUser;
import com.reviewmate.backend.modules.user.infrastructure.persistence.ReviewUserRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReplacementCandidateSearchTest {

    @Mock
    private ReviewUserRepository reviewUserRepository;

    private ReplacementCandidateSearch candidateSearch;

    private final Team backend = team("backend");
    private final Team qa = team("qa");
    private final ReviewUser author = active("author", backend);
    private final ReviewUser alice = active("alice", backend);
    private final ReviewUser quinn = active("quinn", qa);

    @BeforeEach
    void setUp() {
        candidateSearch = new ReplacementCandidateSearch(reviewUserRepository);
    }

    @Test
    @DisplayName("a hit in the reviewer's team stops the search there")
    void stopsAtFirstNonEmptyScope() {
        ReviewUser quentin = active("quentin", qa);
        PullRequest pullRequest = openPullRequest("pr-1", author, quinn, alice);
        when(reviewUserRepository.findByTeamName("qa")).thenReturn(List.of(quinn, quentin));

        CandidateSearchResult result = candidateSearch.findReplacements(pullRequest, quinn);

        assertThat(result.scope()).isEqualTo(CandidateScope.REVIEWER_TEAM);
        assertThat(result.candidates()).extracting(ReviewUser::getId).containsExactly("quentin");
        verify(reviewUserRepository, never()).findByTeamName("backend");
    }

    @Test
    @DisplayName("the organization scope skips every team already searched")
    void organizationScopeExcludesSearchedTeams() {
        ReviewUser olga = active("olga", team("ops"));
        PullRequest pullRequest = openPullRequest("pr-1", author, quinn, alice);
        when(reviewUserRepository.findByTeamName("qa")).thenReturn(List.of(quinn));
        when(reviewUserRepository.findByTeamName("backend")).thenReturn(List.of(author, alice));
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<String>> teams = ArgumentCaptor.forClass(Collection.class);
        when(reviewUserRepository.findActiveExcludingTeams(teams.capture())).thenReturn(List.of(olga));

        CandidateSearchResult result = candidateSearch.findReplacements(pullRequest, quinn);

        assertThat(result.scope()).isEqualTo(CandidateScope.ORGANIZATION);
        assertThat(result.candidates()).containsExactly(olga);
        assertThat(teams.getValue()).containsExactlyInAnyOrder("qa", "backend");
    }

    @Test
    @DisplayName("current reviewers and the author are never candidates")
    void excludesReviewersAndAuthor() {
        ReviewUser bob = active("bob", backend);
        PullRequest pullRequest = openPullRequest("pr-1", author, alice, bob);
        when(reviewUserRepository.findByTeamName("backend")).thenReturn(List.of(author, alice, bob));
        when(reviewUserRepository.findActiveExcludingTeams(Set.of("backend"))).thenReturn(List.of());

        CandidateSearchResult result = candidateSearch.findReplacements(pullRequest, alice);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.scope()).isNull();
    }
}
