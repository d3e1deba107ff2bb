package com.chatgames.arena.api;

import com.chatgames.arena.model.RejectionCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ArenaActionRejectedException.class)
  public ResponseEntity<ApiErrorResponse> handleRejected(ArenaActionRejectedException ex) {
    final RejectionCode code = ex.rejection().code();
    return ResponseEntity.status(statusOf(code))
        .body(new ApiErrorResponse("ARENA_" + code.name(), ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ARENA_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiErrorResponse(
                "ARENA_VALIDATION_ERROR", "missing header: " + ex.getHeaderName()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled arena api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("ARENA_INTERNAL_ERROR", ex.getMessage()));
  }

  static HttpStatus statusOf(RejectionCode code) {
    return switch (code) {
      case NO_ACTIVE_GAME, NO_REMATCH, UNKNOWN_USER -> HttpStatus.NOT_FOUND;
      case NOT_A_PLAYER, NOT_OPPONENT -> HttpStatus.FORBIDDEN;
      case INVALID_POSITION, INVALID_PARAMS, INVALID_MOVE, SELF_CHALLENGE ->
          HttpStatus.BAD_REQUEST;
      case CHANNEL_UNREACHABLE -> HttpStatus.BAD_GATEWAY;
      case UNKNOWN_ENGINE_STATE -> HttpStatus.INTERNAL_SERVER_ERROR;
      case NOT_YOUR_TURN,
          ALREADY_RESOLVED,
          ALREADY_ACTIVE,
          CHALLENGE_CONFLICT,
          CONFIRMATION_PENDING,
          GAME_OVER,
          ALREADY_SUBMITTED -> HttpStatus.CONFLICT;
    };
  }
}
