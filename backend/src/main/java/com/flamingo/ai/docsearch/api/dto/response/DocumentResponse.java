package com.flamingo.ai.docsearch.api.dto.response;

import com.flamingo.ai.docsearch.domain.entity.Document;
import com.flamingo.ai.docsearch.domain.enums.DocumentStatus;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. The text itself is not returned. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private String id;
  private String fileName;
  private String format;
  private Map<String, String> metadata;
  private DocumentStatus status;
  private Integer chunkCount;
  private Integer contentLength;
  private String processingError;
  private LocalDateTime uploadedAt;
  private LocalDateTime processedAt;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .fileName(document.getFileName())
        .format(document.getFormat())
        .metadata(document.getMetadata())
        .status(document.getStatus())
        .chunkCount(document.getChunkCount())
        .contentLength(document.getContent() != null ? document.getContent().length() : 0)
        .processingError(document.getProcessingError())
        .uploadedAt(document.getUploadedAt())
        .processedAt(document.getProcessedAt())
        .build();
  }
}
