package com.flamingo.ai.docsearch.exception;

/**
 * A search that cannot produce a ranking: the index is empty, the fan-out was interrupted or a
 * leg failed for a reason other than the embedding provider.
 */
public class SearchException extends RuntimeException {

  private static final String UNAVAILABLE = "Search is temporarily unavailable. Please try again.";

  private final String userMessage;

  public SearchException(String message) {
    this(message, UNAVAILABLE, null);
  }

  public SearchException(String message, Throwable cause) {
    this(message, UNAVAILABLE, cause);
  }

  public SearchException(String message, String userMessage) {
    this(message, userMessage, null);
  }

  private SearchException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  /** Nothing has been indexed yet, so no query can match. */
  public static SearchException indexEmpty() {
    return new SearchException("Index is empty", "No documents have been indexed yet.");
  }

  /** Message safe to return to API clients. */
  public String getUserMessage() {
    return userMessage;
  }
}
