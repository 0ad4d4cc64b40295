package com.flamingo.ai.docsearch.service.health;

import com.flamingo.ai.docsearch.api.dto.response.SystemStats;
import com.flamingo.ai.docsearch.domain.enums.DocumentStatus;
import com.flamingo.ai.docsearch.domain.repository.DocumentRepository;
import com.flamingo.ai.docsearch.service.cache.SearchCache;
import com.flamingo.ai.docsearch.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docsearch.store.ChunkIndexStore;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of HealthService for system health checks and statistics. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  private final DocumentRepository documentRepository;
  private final ChunkIndexStore chunkIndexStore;
  private final SearchCache searchCache;
  private final EmbeddingService embeddingService;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "health.stats", description = "Time to get system stats")
  public SystemStats getSystemStats() {
    Map<DocumentStatus, Long> byStatus = new EnumMap<>(DocumentStatus.class);
    for (DocumentStatus status : DocumentStatus.values()) {
      byStatus.put(status, documentRepository.countByStatus(status));
    }

    return SystemStats.builder()
        .totalDocuments(documentRepository.count())
        .totalChunks(chunkIndexStore.countChunks())
        .cacheEntries(searchCache.size())
        .documentsByStatus(byStatus)
        .embeddingCacheSize(embeddingService.cacheSize())
        .timestamp(LocalDateTime.now())
        .build();
  }
}
