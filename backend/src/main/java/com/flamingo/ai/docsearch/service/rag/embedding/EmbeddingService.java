package com.flamingo.ai.docsearch.service.rag.embedding;

import com.flamingo.ai.docsearch.domain.enums.EmbeddingSource;
import com.flamingo.ai.docsearch.exception.EmbeddingProviderException;
import com.flamingo.ai.docsearch.util.Fingerprints;
import com.github.benmanes.caffeine.cache.Cache;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Embeds texts with the primary provider, retrying with jittered exponential backoff, and falls
 * back to the local provider for the whole batch once the retries are exhausted.
 *
 * <p>Vectors are cached per tier by content fingerprint, so identical text is sent to a provider
 * at most once while it stays in the cache.
 *
 * <p>Queries take a shorter path: one primary attempt bounded by a caller-supplied budget, then the
 * fallback. Only ingestion batches go through the retry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  @Qualifier("primaryEmbeddingProvider")
  private final EmbeddingProvider primaryProvider;

  @Qualifier("fallbackEmbeddingProvider")
  private final EmbeddingProvider fallbackProvider;

  private final Retry embeddingRetry;
  private final Cache<String, List<Float>> embeddingCache;
  private final MeterRegistry meterRegistry;

  @Qualifier("queryEmbeddingExecutor")
  private final ThreadPoolTaskExecutor queryEmbeddingExecutor;

  /**
   * Embeds a batch of passages.
   *
   * @param texts texts to embed
   * @return vectors in input order, all from one tier
   * @throws EmbeddingProviderException when both tiers fail
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  public EmbeddingBatch embedBatch(List<String> texts) {
    if (texts.isEmpty()) {
      return new EmbeddingBatch(List.of(), primaryProvider.source());
    }
    try {
      List<List<Float>> vectors = embedWith(primaryProvider, texts, true);
      meterRegistry.counter("embedding.requests.success", "source", "primary").increment();
      return new EmbeddingBatch(vectors, primaryProvider.source());
    } catch (EmbeddingProviderException primaryFailure) {
      meterRegistry.counter("embedding.requests.failure", "source", "primary").increment();
      log.warn(
          "Primary embedding failed for batch of {} (rate limited: {}), using fallback: {}",
          texts.size(),
          primaryFailure.isRateLimited(),
          primaryFailure.getMessage());
      return embedWithFallback(texts, primaryFailure);
    }
  }

  /**
   * Embeds a query. The primary gets a single attempt that must finish within {@code
   * primaryBudget}; on failure or timeout the fallback embeds the query instead. Never throws:
   * when both tiers fail the result is empty and the caller ranks by keywords only.
   *
   * @param query query text
   * @param primaryBudget how long to wait for the primary provider
   * @return a batch holding the single query vector, or empty
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  public Optional<EmbeddingBatch> embedQuery(String query, Duration primaryBudget) {
    List<String> texts = List.of(query);
    Future<List<List<Float>>> primaryCall =
        queryEmbeddingExecutor
            .getThreadPoolExecutor()
            .submit(() -> embedWith(primaryProvider, texts, false));
    Throwable primaryFailure;
    try {
      List<List<Float>> vectors =
          primaryCall.get(primaryBudget.toMillis(), TimeUnit.MILLISECONDS);
      meterRegistry.counter("embedding.requests.success", "source", "primary").increment();
      return Optional.of(new EmbeddingBatch(vectors, primaryProvider.source()));
    } catch (TimeoutException e) {
      primaryCall.cancel(true);
      meterRegistry.counter("embedding.query.timeout").increment();
      primaryFailure =
          new EmbeddingProviderException(
              "Primary query embedding exceeded " + primaryBudget.toMillis() + "ms", e);
    } catch (ExecutionException e) {
      meterRegistry.counter("embedding.requests.failure", "source", "primary").increment();
      primaryFailure = e.getCause();
    } catch (InterruptedException e) {
      primaryCall.cancel(true);
      Thread.currentThread().interrupt();
      log.debug("Query embedding interrupted");
      return Optional.empty();
    }

    log.warn("Primary query embedding failed, using fallback: {}", primaryFailure.getMessage());
    try {
      return Optional.of(embedWithFallback(texts, primaryFailure));
    } catch (EmbeddingProviderException e) {
      log.error("Query embedding failed on both tiers: {}", e.getMessage());
      return Optional.empty();
    }
  }

  public long cacheSize() {
    return embeddingCache.estimatedSize();
  }

  private EmbeddingBatch embedWithFallback(List<String> texts, Throwable primaryFailure) {
    try {
      List<List<Float>> vectors = embedWith(fallbackProvider, texts, false);
      meterRegistry.counter("embedding.fallback.used").increment();
      return new EmbeddingBatch(vectors, fallbackProvider.source());
    } catch (EmbeddingProviderException fallbackFailure) {
      meterRegistry.counter("embedding.requests.failure", "source", "fallback").increment();
      fallbackFailure.addSuppressed(primaryFailure);
      throw new EmbeddingProviderException(
          "Both embedding providers failed: " + fallbackFailure.getMessage(), fallbackFailure);
    }
  }

  private List<List<Float>> embedWith(
      EmbeddingProvider provider, List<String> texts, boolean withRetry) {
    List<List<Float>> results = new ArrayList<>(Collections.nCopies(texts.size(), null));
    List<Integer> missingIndexes = new ArrayList<>();
    List<String> missingTexts = new ArrayList<>();

    for (int i = 0; i < texts.size(); i++) {
      List<Float> cached = embeddingCache.getIfPresent(cacheKey(provider.source(), texts.get(i)));
      if (cached != null) {
        results.set(i, cached);
      } else {
        missingIndexes.add(i);
        missingTexts.add(texts.get(i));
      }
    }
    int hits = texts.size() - missingTexts.size();
    if (hits > 0) {
      meterRegistry.counter("embedding.cache.hits").increment(hits);
    }

    if (!missingTexts.isEmpty()) {
      Supplier<List<List<Float>>> call = () -> provider.embed(missingTexts);
      List<List<Float>> vectors = withRetry ? embeddingRetry.executeSupplier(call) : call.get();
      for (int j = 0; j < missingIndexes.size(); j++) {
        int index = missingIndexes.get(j);
        List<Float> vector = List.copyOf(vectors.get(j));
        results.set(index, vector);
        embeddingCache.put(cacheKey(provider.source(), texts.get(index)), vector);
      }
    }
    return results;
  }

  static String cacheKey(EmbeddingSource source, String text) {
    return source.name() + ":" + Fingerprints.sha256(text);
  }
}
