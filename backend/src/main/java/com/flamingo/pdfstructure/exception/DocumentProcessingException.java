package com.flamingo.pdfstructure.exception;

/** Exception thrown when a source document cannot be read. */
public class DocumentProcessingException extends StructureException {

  private final String documentName;
  private final String userMessage;

  public DocumentProcessingException(String documentName, String message) {
    super(Category.IO, "pdf_unreadable", message);
    this.documentName = documentName;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String documentName, String message, Throwable cause) {
    super(Category.IO, "pdf_unreadable", message, cause);
    this.documentName = documentName;
    this.userMessage = "Failed to process document";
  }

  public String getDocumentName() {
    return documentName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
