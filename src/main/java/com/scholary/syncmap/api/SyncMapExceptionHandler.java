package com.scholary.syncmap.api;

import com.scholary.syncmap.syncmap.SyncMapFormatException;
import com.scholary.syncmap.syncmap.SyncMapMissingParameterException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Converts sync map exceptions to HTTP responses with appropriate status codes.
 *
 * <p>Client errors are logged at warn level, server errors at error level with the stack trace.
 */
@RestControllerAdvice
class SyncMapExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyncMapExceptionHandler.class);

  /** Client error - unknown format or invalid argument (HTTP 400). */
  @ExceptionHandler(IllegalArgumentException.class)
  ResponseEntity<ApiError> handleInvalidArgument(IllegalArgumentException ex) {
    LOGGER.warn("Invalid argument: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
  }

  /** Client error - request body failed validation (HTTP 400). */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .sorted()
            .reduce((left, right) -> left + "; " + right)
            .orElse("Validation failed");
    LOGGER.warn("Request validation failed: {}", details);
    return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", details);
  }

  /** Client error - file cannot be read or written (HTTP 403). */
  @ExceptionHandler(AccessDeniedException.class)
  ResponseEntity<ApiError> handleAccessDenied(AccessDeniedException ex) {
    LOGGER.warn("Access denied: file={}, reason={}", ex.getFile(), ex.getReason());
    return error(HttpStatus.FORBIDDEN, ex, "File not accessible", ex.getMessage());
  }

  /** Client error - the format needs a parameter the request did not carry (HTTP 422). */
  @ExceptionHandler(SyncMapMissingParameterException.class)
  ResponseEntity<ApiError> handleMissingParameter(SyncMapMissingParameterException ex) {
    LOGGER.warn("Missing parameter: {}", ex.getParameterName());
    return error(HttpStatus.UNPROCESSABLE_ENTITY, ex, "Missing parameter", ex.getMessage());
  }

  /** Client error - the input file is malformed (HTTP 422). */
  @ExceptionHandler(SyncMapFormatException.class)
  ResponseEntity<ApiError> handleFormat(SyncMapFormatException ex) {
    LOGGER.warn("Malformed sync map: {}", ex.getMessage());
    return error(HttpStatus.UNPROCESSABLE_ENTITY, ex, "Malformed sync map", ex.getMessage());
  }

  /** Server error - reading or writing failed (HTTP 500). */
  @ExceptionHandler(IOException.class)
  ResponseEntity<ApiError> handleIo(IOException ex) {
    LOGGER.error("I/O failure", ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, ex, "I/O failure", "Reading or writing a file failed");
  }

  private static ResponseEntity<ApiError> error(
      HttpStatus status, Exception ex, String message, String details) {
    return ResponseEntity.status(status)
        .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
  }

  /** Standardized error response for API clients. */
  record ApiError(String errorCode, String message, String details, Instant timestamp) {}
}
