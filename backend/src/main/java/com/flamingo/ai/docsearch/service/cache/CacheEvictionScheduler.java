package com.flamingo.ai.docsearch.service.cache;

import com.flamingo.ai.docsearch.config.RagConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Drops search cache entries that have not been read within the retention window. */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheEvictionScheduler {

  private final SearchCache searchCache;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Scheduled(
      fixedDelayString = "${rag.cache.eviction-interval:PT10M}",
      initialDelayString = "${rag.cache.eviction-interval:PT10M}")
  public void scheduledEviction() {
    try {
      evictExpired();
    } catch (RuntimeException e) {
      log.warn("Search cache eviction failed: {}", e.getMessage(), e);
    }
  }

  /**
   * Evicts expired entries now.
   *
   * @return number of entries removed
   */
  public int evictExpired() {
    Duration retention = Duration.ofHours(ragConfig.getCache().getRetentionHours());
    int removed = searchCache.evictExpired(retention);
    meterRegistry.counter("search.cache.evicted").increment(removed);
    log.info("Search cache eviction removed {} entries, {} remain", removed, searchCache.size());
    return removed;
  }
}
