package com.flamingo.ai.docextract.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ExtractionFileNotFoundException.class)
  public ResponseEntity<ApiError> handleFileNotFound(
      ExtractionFileNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("file_not_found");
    String errorId = generateErrorId();
    log.warn("File not found [{}]: {}", errorId, ex.getFileId());

    return build(HttpStatus.NOT_FOUND, errorId, ApiError.FILE_NOT_FOUND, "File not found", request);
  }

  @ExceptionHandler(JobPersistenceException.class)
  public ResponseEntity<ApiError> handlePersistence(
      JobPersistenceException ex, HttpServletRequest request) {

    incrementErrorCounter("job_persistence");
    String errorId = generateErrorId();
    log.error("Job persistence error [{}] for {}: {}", errorId, ex.getFileId(), ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.EXTRACTION_PERSISTENCE_ERROR,
        "Extraction state could not be saved. Please try again later.",
        request);
  }

  @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class})
  public ResponseEntity<ApiError> handleInvalidRequest(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_request");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
