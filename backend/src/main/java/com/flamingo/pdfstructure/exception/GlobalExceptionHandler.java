package com.flamingo.pdfstructure.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_unreadable");
    String errorId = generateErrorId();
    log.error(
        "Document processing error [{}] for '{}': {}",
        errorId,
        ex.getDocumentName(),
        ex.getMessage(),
        ex);

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DOCUMENT_UNREADABLE)
                .reason(ex.getErrorCode())
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(NumberingViolationException.class)
  public ResponseEntity<ApiError> handleNumberingViolation(
      NumberingViolationException ex, HttpServletRequest request) {

    incrementErrorCounter("numbering_violation");
    String errorId = generateErrorId();
    log.warn("Strict numbering violation [{}]: {}", errorId, ex.getMessage());

    List<String> details =
        ex.getViolations().stream().map(e -> e.category() + ": " + e.message()).toList();
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.NUMBERING_VIOLATION)
                .reason(ex.getErrorCode())
                .message("Document numbering violates the configured rules")
                .details(details)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(InvalidConfigurationException.class)
  public ResponseEntity<ApiError> handleInvalidConfiguration(
      InvalidConfigurationException ex, HttpServletRequest request) {

    incrementErrorCounter("configuration_error");
    String errorId = generateErrorId();
    log.error("Invalid configuration [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.CONFIGURATION_ERROR)
                .reason(ex.getErrorCode())
                .message("The service is misconfigured")
                .details(List.of(ex.getProperty()))
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  /** Frozen-node mutation and unresolvable slug collisions. */
  @ExceptionHandler(StructureException.class)
  public ResponseEntity<ApiError> handleStructure(
      StructureException ex, HttpServletRequest request) {

    incrementErrorCounter("structure_error");
    String errorId = generateErrorId();
    log.error("Structure error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.STRUCTURE_ERROR)
                .reason(ex.getErrorCode())
                .message("The document structure could not be built")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<ApiError> handleMissingPart(
      MissingServletRequestPartException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Missing request part [{}]: {}", errorId, ex.getRequestPartName());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message("Missing request part: " + ex.getRequestPartName())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
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
