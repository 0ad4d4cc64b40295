package com.flamingo.ai.docsearch.exception;

/** Exception thrown when an embedding provider cannot produce vectors. */
public class EmbeddingProviderException extends RuntimeException {

  private final boolean rateLimited;

  public EmbeddingProviderException(String message) {
    super(message);
    this.rateLimited = false;
  }

  public EmbeddingProviderException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = false;
  }

  public EmbeddingProviderException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }
}
