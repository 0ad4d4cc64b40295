package com.flamingo.ai.docsearch.api.dto.response;

import com.flamingo.ai.docsearch.domain.enums.EmbeddingSource;
import com.flamingo.ai.docsearch.elasticsearch.DocumentChunk;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an indexed chunk, without its vector. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

  private String id;
  private String documentId;
  private int chunkIndex;
  private String content;
  private String fingerprint;
  private List<String> keywords;
  private EmbeddingSource embeddingSource;
  private int embeddingDimension;
  private int wordCount;
  private int charCount;
  private Instant createdAt;

  public static ChunkResponse fromChunk(DocumentChunk chunk) {
    return ChunkResponse.builder()
        .id(chunk.getId())
        .documentId(chunk.getDocumentId())
        .chunkIndex(chunk.getChunkIndex())
        .content(chunk.getContent())
        .fingerprint(chunk.getFingerprint())
        .keywords(chunk.getKeywords())
        .embeddingSource(chunk.getEmbeddingSource())
        .embeddingDimension(chunk.getEmbeddingDimension())
        .wordCount(chunk.getWordCount())
        .charCount(chunk.getCharCount())
        .createdAt(chunk.getCreatedAt())
        .build();
  }
}
