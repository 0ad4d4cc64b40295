package com.flamingo.ai.docsearch.exception;

/** Exception thrown when a document is not found. */
public class DocumentNotFoundException extends RuntimeException {

  private final String documentId;

  public DocumentNotFoundException(String documentId) {
    super("Document not found: " + documentId);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
