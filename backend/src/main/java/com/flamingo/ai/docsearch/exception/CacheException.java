package com.flamingo.ai.docsearch.exception;

/** Exception thrown by the search cache. Callers treat it as a miss or a skipped write. */
public class CacheException extends RuntimeException {

  public CacheException(String message, Throwable cause) {
    super(message, cause);
  }
}
