package com.flamingo.ai.docsearch.exception;

/** Exception thrown when document processing fails. */
public class DocumentProcessingException extends RuntimeException {

  private final String documentId;
  private final String userMessage;

  public DocumentProcessingException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to process document";
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
