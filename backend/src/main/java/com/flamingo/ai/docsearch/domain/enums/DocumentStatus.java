package com.flamingo.ai.docsearch.domain.enums;

/** Processing status of an ingested document. Moves forward only. */
public enum DocumentStatus {
  /** Document has been stored but not yet processed. */
  PENDING,

  /** Document is being chunked, embedded and indexed. */
  PROCESSING,

  /** All chunks are indexed and searchable. */
  COMPLETED,

  /** Processing failed; terminal until the document is explicitly reprocessed. */
  FAILED;

  /**
   * Returns whether this status may move to {@code next}.
   *
   * @param next the requested status
   * @return true if the transition is allowed
   */
  public boolean canTransitionTo(DocumentStatus next) {
    return switch (this) {
      case PENDING -> next == PROCESSING || next == FAILED;
      case PROCESSING -> next == COMPLETED || next == FAILED;
      case COMPLETED, FAILED -> false;
    };
  }
}
