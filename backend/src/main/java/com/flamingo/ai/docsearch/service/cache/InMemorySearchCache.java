package com.flamingo.ai.docsearch.service.cache;

import com.flamingo.ai.docsearch.service.rag.model.ScoredResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link SearchCache} over a {@link ConcurrentHashMap}; every operation is atomic per key. */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemorySearchCache implements SearchCache {

  private final Clock clock;
  private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
  private final AtomicLong generation = new AtomicLong();

  @Override
  public Optional<CacheEntry> get(String key) {
    Instant now = clock.instant();
    long current = generation.get();
    return Optional.ofNullable(
        entries.computeIfPresent(
            key, (k, entry) -> entry.generation() < current ? null : entry.touchedAt(now)));
  }

  @Override
  public void put(String key, List<ScoredResult> results, long resultGeneration) {
    if (resultGeneration < generation.get()) {
      log.debug("Dropping search results computed before the last invalidation");
      return;
    }
    entries.put(key, CacheEntry.of(results, clock.instant(), resultGeneration));
  }

  @Override
  public long generation() {
    return generation.get();
  }

  @Override
  public int evictExpired(Duration retention) {
    Instant cutoff = clock.instant().minus(retention);
    int removed = 0;
    for (String key : entries.keySet()) {
      // re-checked under the key's lock so a concurrent get keeps the entry alive
      if (entries.computeIfPresent(
              key, (k, entry) -> entry.lastAccessedAt().isBefore(cutoff) ? null : entry)
          == null) {
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Evicted {} search cache entries older than {}", removed, retention);
    }
    return removed;
  }

  @Override
  public long size() {
    return entries.size();
  }

  @Override
  public void clear() {
    generation.incrementAndGet();
    entries.clear();
  }
}
