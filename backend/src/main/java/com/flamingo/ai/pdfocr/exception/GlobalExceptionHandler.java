package com.flamingo.ai.pdfocr.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(
      JobNotFoundException ex, HttpServletRequest request) {
    incrementErrorCounter("job_not_found");
    String errorId = generateErrorId();
    log.warn("Job not found [{}]: {}", errorId, ex.getJobId());
    return error(HttpStatus.NOT_FOUND, errorId, ApiError.JOB_NOT_FOUND, "Job not found", request);
  }

  @ExceptionHandler(ArtifactNotFoundException.class)
  public ResponseEntity<ApiError> handleArtifactNotFound(
      ArtifactNotFoundException ex, HttpServletRequest request) {
    incrementErrorCounter("artifact_not_found");
    String errorId = generateErrorId();
    log.warn(
        "Artifact not found [{}]: job={}, artifact={}", errorId, ex.getJobId(), ex.getArtifact());
    return error(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.ARTIFACT_NOT_FOUND,
        "Result not found: " + ex.getArtifact(),
        request);
  }

  @ExceptionHandler(InvalidDocumentException.class)
  public ResponseEntity<ApiError> handleInvalidDocument(
      InvalidDocumentException ex, HttpServletRequest request) {
    incrementErrorCounter("invalid_document");
    String errorId = generateErrorId();
    log.warn("Rejected upload [{}]: {}", errorId, ex.getMessage());
    return error(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getUserMessage(), request);
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());
    return error(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {
    incrementErrorCounter("upload_too_large");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());
    return error(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Uploaded file is too large",
        request);
  }

  @ExceptionHandler({
    DuplicateJobIdException.class,
    ArtifactAlreadyExistsException.class,
    IllegalJobTransitionException.class
  })
  public ResponseEntity<ApiError> handleConflict(RuntimeException ex, HttpServletRequest request) {
    incrementErrorCounter("job_conflict");
    String errorId = generateErrorId();
    log.error("Job conflict [{}]: {}", errorId, ex.getMessage(), ex);
    return error(HttpStatus.CONFLICT, errorId, ApiError.JOB_CONFLICT, ex.getMessage(), request);
  }

  @ExceptionHandler(ArtifactStorageException.class)
  public ResponseEntity<ApiError> handleArtifactStorage(
      ArtifactStorageException ex, HttpServletRequest request) {
    incrementErrorCounter("artifact_storage");
    String errorId = generateErrorId();
    log.error("Artifact storage error [{}]: {}", errorId, ex.getMessage(), ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.ARTIFACT_STORAGE_ERROR,
        "Could not access job files",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
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
