package io.linkup.matchmaking.api;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void invalidCriteriaReturns400() {
    final var response =
        handler.handleMatchmaking(MatchmakingException.invalidCriteria("interests required"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse("MATCHMAKING_INVALID_CRITERIA", "interests required"));
  }

  @Test
  void proposalNotFoundReturns404() {
    final var response =
        handler.handleMatchmaking(MatchmakingException.proposalNotFound("p-1"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().code()).isEqualTo("MATCHMAKING_PROPOSAL_NOT_FOUND");
  }

  @Test
  void notAParticipantReturns403() {
    final var response =
        handler.handleMatchmaking(MatchmakingException.notAParticipant("p-1", "eve"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(response.getBody().code()).isEqualTo("MATCHMAKING_NOT_A_PARTICIPANT");
  }

  @Test
  void stateConflictsReturn409() {
    assertThat(handler.handleMatchmaking(MatchmakingException.alreadyQueued("a")).getStatusCode())
        .isEqualTo(HttpStatus.CONFLICT);
    assertThat(
            handler.handleMatchmaking(MatchmakingException.alreadyInProposal("a")).getStatusCode())
        .isEqualTo(HttpStatus.CONFLICT);
    assertThat(
            handler.handleMatchmaking(MatchmakingException.alreadyTerminal("p-1")).getStatusCode())
        .isEqualTo(HttpStatus.CONFLICT);
    final var decided = handler.handleMatchmaking(MatchmakingException.alreadyDecided("p-1", "a"));
    assertThat(decided.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(decided.getBody().code()).isEqualTo("MATCHMAKING_ALREADY_DECIDED");
  }

  @Test
  void handleValidationReturns400() {
    final var response = handler.handleValidation((MethodArgumentNotValidException) null);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().code()).isEqualTo("MATCHMAKING_VALIDATION_ERROR");
  }

  @Test
  void handleRuntimeReturns500() {
    final var response = handler.handleRuntime(new RuntimeException("oops"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo("MATCHMAKING_INTERNAL_ERROR");
  }
}
