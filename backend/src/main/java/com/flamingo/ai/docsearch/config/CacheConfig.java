package com.flamingo.ai.docsearch.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Cache infrastructure: the embedding cache and the clock used by the search cache. */
@Configuration
@RequiredArgsConstructor
public class CacheConfig {

  private final RagConfig ragConfig;

  /**
   * Vectors keyed by provider source and content fingerprint, so identical text is only embedded
   * once per tier.
   */
  @Bean
  public Cache<String, List<Float>> embeddingCache() {
    return Caffeine.newBuilder()
        .maximumSize(ragConfig.getEmbedding().getCacheMaxEntries())
        .expireAfterAccess(Duration.ofHours(ragConfig.getCache().getRetentionHours()))
        .recordStats()
        .build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
