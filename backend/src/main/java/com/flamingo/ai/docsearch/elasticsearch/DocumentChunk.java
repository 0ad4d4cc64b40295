package com.flamingo.ai.docsearch.elasticsearch;

import com.flamingo.ai.docsearch.domain.enums.EmbeddingSource;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A passage of a document as stored in the chunk index, with its vector and keyword
 * representations.
 *
 * <p>The id is {@code <documentId>_<chunkIndex>}, so re-indexing the same document overwrites its
 * chunks instead of duplicating them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunk {

  private String id;
  private String documentId;
  private String fileName;
  private int chunkIndex;
  private String content;

  /** SHA-256 of {@link #content}. */
  private String fingerprint;

  private List<Float> embedding;

  /** Provider tier that produced {@link #embedding}; only same-tier vectors are compared. */
  private EmbeddingSource embeddingSource;

  private int embeddingDimension;

  @Builder.Default private List<String> keywords = List.of();

  private int wordCount;
  private int charCount;
  private Instant createdAt;

  /**
   * Builds the deterministic chunk id.
   *
   * @param documentId owning document id
   * @param chunkIndex zero-based position in the document
   * @return the chunk id
   */
  public static String chunkId(String documentId, int chunkIndex) {
    return documentId + "_" + chunkIndex;
  }
}
