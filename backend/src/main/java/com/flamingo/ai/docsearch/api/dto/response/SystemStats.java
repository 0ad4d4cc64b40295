package com.flamingo.ai.docsearch.api.dto.response;

import com.flamingo.ai.docsearch.domain.enums.DocumentStatus;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for system-wide statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStats {
  private long totalDocuments;
  private long totalChunks;
  private long cacheEntries;
  private Map<DocumentStatus, Long> documentsByStatus;
  private long embeddingCacheSize;
  private LocalDateTime timestamp;
}
