package com.flamingo.ai.docsearch.exception;

/** Exception thrown when the chunk index store is unreachable or rejects an operation. */
public class IndexStoreException extends RuntimeException {

  private final String operation;

  public IndexStoreException(String operation, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
  }

  public IndexStoreException(String operation, String message) {
    super(message);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }
}
