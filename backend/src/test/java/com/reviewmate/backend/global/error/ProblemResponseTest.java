package com.reviewmate.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ProblemResponseTest {

    @Test
    @DisplayName("domain codes keep their status and get a stable type")
    void fromProblemException() {
        ProblemResponse body = ProblemResponse.of(ProblemCodes.noCandidate("pr-1"), "/pullRequest/reassign");

        assertThat(body.status()).isEqualTo(409);
        assertThat(body.code()).isEqualTo("NO_CANDIDATE");
        assertThat(body.type()).isEqualTo("urn:problem:reviewmate:no_candidate");
        assertThat(body.detail()).contains("pr-1");
        assertThat(body.instance()).isEqualTo("/pullRequest/reassign");
    }

    @Test
    @DisplayName("every factory pairs its code with the documented status")
    void factoryStatuses() {
        assertThat(ProblemCodes.teamExists("t").getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ProblemCodes.pullRequestExists("p").getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ProblemCodes.pullRequestMerged("p").getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ProblemCodes.notAssigned("p", "u").getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ProblemCodes.noCandidate("p").getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ProblemCodes.notFound("user", "u").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(ProblemCodes.invalid("bad").getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    @DisplayName("a blank code is a programming error")
    void blankCodeRejected() {
        assertThatThrownBy(() -> new ProblemException(HttpStatus.BAD_REQUEST, " ", "detail"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
