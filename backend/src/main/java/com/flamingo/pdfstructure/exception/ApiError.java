package com.flamingo.pdfstructure.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String DOCUMENT_UNREADABLE = "DOCUMENT_001";
  public static final String NUMBERING_VIOLATION = "STRUCTURE_001";
  public static final String STRUCTURE_ERROR = "STRUCTURE_002";
  public static final String CONFIGURATION_ERROR = "CONFIG_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** Pipeline error code, e.g. {@code pdf_unreadable}. */
  private final String reason;

  /** User-friendly error message. */
  private final String message;

  /** Offending values, one entry per violation. */
  private final List<String> details;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
