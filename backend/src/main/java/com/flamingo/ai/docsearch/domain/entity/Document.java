package com.flamingo.ai.docsearch.domain.entity;

import com.flamingo.ai.docsearch.domain.converter.MetadataMapConverter;
import com.flamingo.ai.docsearch.domain.enums.DocumentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * An ingested document. The id is the SHA-256 fingerprint of the cleaned text, so identical
 * content always maps to the same row.
 *
 * <p>Only the processing fields change after creation, and only through the status methods below.
 */
@Entity
@Table(name = "documents")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Document {

  @Id
  @Column(length = 64)
  private String id;

  @Column(nullable = false)
  private String fileName;

  /** Source format tag supplied by the caller, e.g. txt, md, pdf. */
  @Column(nullable = false)
  private String format;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String content;

  @Convert(converter = MetadataMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, String> metadata = new HashMap<>();

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.PENDING;

  /** Number of chunks indexed for this document. */
  @Builder.Default private Integer chunkCount = 0;

  /** Error message if processing failed. */
  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime uploadedAt;

  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    if (uploadedAt == null) {
      uploadedAt = LocalDateTime.now();
    }
  }

  /** Marks the document as processing. */
  public void startProcessing() {
    transitionTo(DocumentStatus.PROCESSING);
    this.processingError = null;
  }

  /** Marks the document as successfully processed. */
  public void markCompleted(int chunkCount) {
    transitionTo(DocumentStatus.COMPLETED);
    this.chunkCount = chunkCount;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the document as failed with an error message. */
  public void markFailed(String errorMessage) {
    transitionTo(DocumentStatus.FAILED);
    this.processingError = errorMessage;
    this.processedAt = LocalDateTime.now();
  }

  /** Puts a processed document back to PENDING so it can be chunked and indexed again. */
  public void resetForReprocessing() {
    if (status == DocumentStatus.PENDING || status == DocumentStatus.PROCESSING) {
      throw new IllegalStateException(
          "Document " + id + " cannot be reprocessed while " + status);
    }
    this.status = DocumentStatus.PENDING;
    this.chunkCount = 0;
    this.processingError = null;
    this.processedAt = null;
  }

  private void transitionTo(DocumentStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Document " + id + " cannot move from " + status + " to " + next);
    }
    this.status = next;
  }
}
