package com.flamingo.pdfstructure.exception;

/** Base class for failures raised while building a document structure. */
public class StructureException extends RuntimeException {

  /** Error families; each maps to a distinct caller-facing outcome. */
  public enum Category {
    CONFIG,
    IO,
    PARSE
  }

  private final Category category;
  private final String errorCode;

  public StructureException(Category category, String errorCode, String message) {
    super(message);
    this.category = category;
    this.errorCode = errorCode;
  }

  public StructureException(
      Category category, String errorCode, String message, Throwable cause) {
    super(message, cause);
    this.category = category;
    this.errorCode = errorCode;
  }

  public Category getCategory() {
    return category;
  }

  public String getErrorCode() {
    return errorCode;
  }
}
