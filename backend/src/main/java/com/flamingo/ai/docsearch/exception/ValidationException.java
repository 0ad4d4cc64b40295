package com.flamingo.ai.docsearch.exception;

/** Exception thrown when caller input is rejected before any work is done. */
public class ValidationException extends RuntimeException {

  private final String field;

  public ValidationException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
