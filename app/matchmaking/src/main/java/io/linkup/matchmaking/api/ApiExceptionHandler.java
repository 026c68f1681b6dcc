package io.linkup.matchmaking.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MatchmakingException.class)
  public ResponseEntity<ApiErrorResponse> handleMatchmaking(MatchmakingException ex) {
    return ResponseEntity.status(statusOf(ex.code()))
        .body(new ApiErrorResponse("MATCHMAKING_" + ex.code().name(), ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("MATCHMAKING_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("MATCHMAKING_BAD_REQUEST", "request body is not readable"));
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiErrorResponse(
                "MATCHMAKING_BAD_REQUEST", "missing header " + ex.getHeaderName()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("matchmaking request failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("MATCHMAKING_INTERNAL_ERROR", ex.getMessage()));
  }

  private static HttpStatus statusOf(MatchmakingErrorCode code) {
    return switch (code) {
      case INVALID_CRITERIA -> HttpStatus.BAD_REQUEST;
      case PROPOSAL_NOT_FOUND -> HttpStatus.NOT_FOUND;
      case NOT_A_PARTICIPANT -> HttpStatus.FORBIDDEN;
      case ALREADY_QUEUED, ALREADY_IN_PROPOSAL, ALREADY_TERMINAL, ALREADY_DECIDED ->
          HttpStatus.CONFLICT;
    };
  }
}
