package com.flamingo.ai.docsearch.service.cache;

import com.flamingo.ai.docsearch.service.rag.model.ScoredResult;
import java.time.Instant;
import java.util.List;

/**
 * A cached ranked result list.
 *
 * @param results ranked results, immutable
 * @param resultCount number of results
 * @param createdAt when the entry was written
 * @param lastAccessedAt last read or write; drives eviction
 * @param generation cache generation the results were computed in
 */
public record CacheEntry(
    List<ScoredResult> results,
    int resultCount,
    Instant createdAt,
    Instant lastAccessedAt,
    long generation) {

  public CacheEntry {
    results = List.copyOf(results);
  }

  static CacheEntry of(List<ScoredResult> results, Instant now, long generation) {
    return new CacheEntry(results, results.size(), now, now, generation);
  }

  CacheEntry touchedAt(Instant now) {
    return new CacheEntry(results, resultCount, createdAt, now, generation);
  }
}
