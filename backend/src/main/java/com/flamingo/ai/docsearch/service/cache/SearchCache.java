package com.flamingo.ai.docsearch.service.cache;

import com.flamingo.ai.docsearch.exception.CacheException;
import com.flamingo.ai.docsearch.service.rag.model.ScoredResult;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key-value store for ranked search results with age-based eviction only. Implementations must be
 * safe for concurrent use and may throw {@link CacheException}.
 *
 * <p>Every {@link #clear()} starts a new generation. Results computed before a clear carry the old
 * generation and are never served afterwards, even when their write lands after the clear.
 */
public interface SearchCache {

  /**
   * Looks up an entry and refreshes its last access time.
   *
   * @param key query fingerprint
   * @return the entry, or empty on a miss
   */
  Optional<CacheEntry> get(String key);

  /**
   * Stores results computed in the current generation, replacing any previous entry.
   *
   * @param key query fingerprint
   * @param results ranked results
   */
  default void put(String key, List<ScoredResult> results) {
    put(key, results, generation());
  }

  /**
   * Stores results computed in {@code generation}. Results from an earlier generation are dropped.
   *
   * @param key query fingerprint
   * @param results ranked results
   * @param generation value of {@link #generation()} read before the results were computed
   */
  void put(String key, List<ScoredResult> results, long generation);

  /** Current generation; advanced by every {@link #clear()}. */
  long generation();

  /**
   * Removes entries whose last access is older than the retention window.
   *
   * @param retention retention window
   * @return number of entries removed
   */
  int evictExpired(Duration retention);

  long size();

  /** Removes every entry and starts a new generation. */
  void clear();
}
