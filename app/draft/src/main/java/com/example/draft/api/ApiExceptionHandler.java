package com.example.draft.api;

import com.google.common.util.concurrent.UncheckedTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidDraftRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidDraftRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("DRAFT_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("DRAFT_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("DRAFT_BAD_REQUEST", ex.getHeaderName() + " is required"));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("DRAFT_BAD_REQUEST", ex.getName() + " is invalid"));
  }

  @ExceptionHandler(DraftRoomNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(DraftRoomNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("DRAFT_ROOM_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(ParticipantAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(
      ParticipantAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse("DRAFT_FORBIDDEN", ex.getMessage()));
  }

  @ExceptionHandler(PickRejectedException.class)
  public ResponseEntity<ApiErrorResponse> handlePickRejected(PickRejectedException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ex.errorCode().name(), ex.getMessage()));
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ApiErrorResponse> handleStateConflict(IllegalStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("DRAFT_STATE_CONFLICT", ex.getMessage()));
  }

  @ExceptionHandler(UncheckedTimeoutException.class)
  public ResponseEntity<ApiErrorResponse> handleTimeout(UncheckedTimeoutException ex) {
    logger.warn("draft engine did not respond in time", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("DRAFT_ENGINE_TIMEOUT", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled draft api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("DRAFT_INTERNAL_ERROR", ex.getMessage()));
  }
}
