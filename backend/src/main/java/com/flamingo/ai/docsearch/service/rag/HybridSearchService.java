package com.flamingo.ai.docsearch.service.rag;

import com.flamingo.ai.docsearch.config.RagConfig;
import com.flamingo.ai.docsearch.domain.enums.EmbeddingSource;
import com.flamingo.ai.docsearch.domain.enums.SearchMode;
import com.flamingo.ai.docsearch.elasticsearch.DocumentChunk;
import com.flamingo.ai.docsearch.exception.IndexStoreException;
import com.flamingo.ai.docsearch.exception.SearchException;
import com.flamingo.ai.docsearch.exception.ValidationException;
import com.flamingo.ai.docsearch.service.cache.CacheEntry;
import com.flamingo.ai.docsearch.service.cache.SearchCache;
import com.flamingo.ai.docsearch.service.rag.embedding.EmbeddingBatch;
import com.flamingo.ai.docsearch.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docsearch.service.rag.model.ScoredResult;
import com.flamingo.ai.docsearch.store.ChunkIndexStore;
import com.flamingo.ai.docsearch.store.KeywordHit;
import com.flamingo.ai.docsearch.store.SemanticHit;
import com.flamingo.ai.docsearch.util.Fingerprints;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Hybrid search combining vector similarity and keyword matching with weighted score fusion.
 *
 * <p>A query moves through {@link SearchState}: results are served from the {@link SearchCache}
 * when possible; otherwise the semantic and keyword legs run concurrently on the search executor,
 * each bounded by the leg timeout, and their normalized scores are fused as {@code
 * semanticWeight * semantic + keywordWeight * keyword}. Results below the relevance floor are
 * dropped and the rest are ordered by the fused score times a ranking boost for exact phrase,
 * keyword-count and early-position matches. Identical concurrent queries share one computation.
 *
 * <p>Only complete results are cached: when a requested leg timed out or the query vector came
 * from the fallback tier, the results are returned but not stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridSearchService {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final int EARLY_MATCH_CHARS = 100;
  private static final int SUGGESTION_CANDIDATES = 20;
  private static final int MIN_SUGGESTION_LENGTH = 2;

  /** Lifecycle of a single query. */
  enum SearchState {
    RECEIVED,
    EMBEDDING,
    RETRIEVING,
    FUSING,
    CACHED,
    RETURNED,
    FAILED
  }

  private final ChunkIndexStore chunkIndexStore;
  private final EmbeddingService embeddingService;
  private final KeywordExtractor keywordExtractor;
  private final SearchCache searchCache;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Qualifier("searchExecutor")
  private final ThreadPoolTaskExecutor searchExecutor;

  private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

  /** A computation shared by every caller asking for the same fingerprint. */
  private static final class InFlight {
    private final CompletableFuture<List<ScoredResult>> result = new CompletableFuture<>();
    private final AtomicInteger waiters = new AtomicInteger(1);
  }

  /** Outcome of the semantic leg; absent when no query vector could be produced. */
  private record SemanticOutcome(List<SemanticHit> hits, boolean fallback) {}

  /**
   * Searches the index.
   *
   * @param query free-text query
   * @param mode which legs to run
   * @param limit maximum number of results
   * @return results ordered by fused score, possibly empty
   * @throws ValidationException when the query or limit is rejected
   * @throws SearchException when the index is empty or the search could not run
   * @throws IndexStoreException when the index store fails
   */
  @Timed(value = "rag.search", description = "Time for hybrid search")
  public List<ScoredResult> search(String query, SearchMode mode, int limit) {
    validate(query, limit);
    SearchMode searchMode = mode != null ? mode : SearchMode.HYBRID;
    String key = cacheKey(query, searchMode, limit);
    transition(key, SearchState.RECEIVED);

    // read before the lookup so results computed across an invalidation are never stored
    long generation = readGeneration();
    Optional<List<ScoredResult>> cached = readCache(key);
    if (cached.isPresent()) {
      meterRegistry.counter("rag.search.cache", "result", "hit").increment();
      transition(key, SearchState.RETURNED);
      return cached.get();
    }
    meterRegistry.counter("rag.search.cache", "result", "miss").increment();
    return joinOrCompute(key, query, searchMode, limit, generation, true);
  }

  /** Number of callers currently waiting on an in-flight computation, leaders included. */
  @VisibleForTesting
  int inFlightWaiters() {
    return inFlight.values().stream().mapToInt(flight -> flight.waiters.get()).sum();
  }

  private List<ScoredResult> joinOrCompute(
      String key,
      String query,
      SearchMode mode,
      int limit,
      long generation,
      boolean retryOnCancel) {
    InFlight created = new InFlight();
    InFlight existing = inFlight.putIfAbsent(key, created);
    if (existing == null) {
      return lead(key, created, query, mode, limit, generation);
    }

    existing.waiters.incrementAndGet();
    meterRegistry.counter("rag.search.coalesced").increment();
    log.debug("Query {} joins the in-flight computation", abbreviate(key));
    try {
      return existing.result.get(followerTimeoutMillis(), TimeUnit.MILLISECONDS);
    } catch (CancellationException e) {
      if (retryOnCancel) {
        log.debug("In-flight computation for {} was cancelled, recomputing", abbreviate(key));
        return joinOrCompute(key, query, mode, limit, readGeneration(), false);
      }
      throw new SearchException("Search was cancelled", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SearchException("Search was interrupted", e);
    } catch (TimeoutException e) {
      throw new SearchException("Timed out waiting for an identical search", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new SearchException("Search failed: " + e.getCause().getMessage(), e.getCause());
    } finally {
      existing.waiters.decrementAndGet();
    }
  }

  private List<ScoredResult> lead(
      String key, InFlight flight, String query, SearchMode mode, int limit, long generation) {
    try {
      // a previous leader may have written the entry between our miss and taking over
      Optional<List<ScoredResult>> cached = readCache(key);
      List<ScoredResult> results =
          cached.isPresent() ? cached.get() : compute(key, query, mode, limit, generation);
      // unregistered before completion so a follower retrying after a cancel cannot rejoin it
      inFlight.remove(key, flight);
      flight.result.complete(results);
      meterRegistry.counter("rag.search.success").increment();
      transition(key, SearchState.RETURNED);
      return results;
    } catch (InterruptedException e) {
      inFlight.remove(key, flight);
      flight.result.completeExceptionally(new CancellationException("Leader interrupted"));
      Thread.currentThread().interrupt();
      transition(key, SearchState.FAILED);
      throw new SearchException("Search was interrupted", e);
    } catch (RuntimeException e) {
      inFlight.remove(key, flight);
      flight.result.completeExceptionally(e);
      meterRegistry.counter("rag.search.failure").increment();
      transition(key, SearchState.FAILED);
      throw e;
    } finally {
      inFlight.remove(key, flight);
    }
  }

  private List<ScoredResult> compute(
      String key, String query, SearchMode mode, int limit, long generation)
      throws InterruptedException {
    if (chunkIndexStore.countChunks() == 0) {
      throw SearchException.indexEmpty();
    }

    RagConfig.Retrieval settings = ragConfig.getRetrieval();
    int candidates = limit * Math.max(1, settings.getOverFetchMultiplier());
    List<String> terms = keywordExtractor.queryTerms(query);
    long deadline = System.nanoTime() + settings.getLegTimeout().toNanos();

    Future<SemanticOutcome> semanticLeg = null;
    Future<List<KeywordHit>> keywordLeg = null;
    if (mode != SearchMode.KEYWORD) {
      transition(key, SearchState.EMBEDDING);
      semanticLeg = submit(() -> runSemanticLeg(query, candidates));
    }
    transition(key, SearchState.RETRIEVING);
    // in semantic mode the keyword leg stands by in case no query vector can be produced
    if (!terms.isEmpty()) {
      keywordLeg = submit(() -> chunkIndexStore.keywordSearch(terms, candidates));
    }

    SemanticOutcome semantic;
    List<KeywordHit> keyword;
    try {
      semantic = await(semanticLeg, deadline, "semantic");
      if (mode == SearchMode.SEMANTIC && semantic != null) {
        cancel(keywordLeg);
        keyword = null;
      } else {
        keyword = await(keywordLeg, deadline, "keyword");
      }
    } catch (InterruptedException | RuntimeException e) {
      cancel(semanticLeg);
      cancel(keywordLeg);
      throw e;
    }

    boolean semanticAvailable = semantic != null && !semantic.hits().isEmpty();
    boolean degraded = mode != SearchMode.KEYWORD && (semantic == null || semantic.fallback());
    boolean keywordMissing = mode != SearchMode.SEMANTIC && keywordLeg != null && keyword == null;
    double semanticWeight = 0;
    double keywordWeight = 0;
    if (mode == SearchMode.HYBRID) {
      double total = settings.getSemanticWeight() + settings.getKeywordWeight();
      semanticWeight = total > 0 ? settings.getSemanticWeight() / total : 0.5;
      keywordWeight = total > 0 ? settings.getKeywordWeight() / total : 0.5;
    } else if (mode == SearchMode.SEMANTIC && semantic != null) {
      semanticWeight = 1;
    } else {
      keywordWeight = 1;
    }
    if (mode == SearchMode.SEMANTIC && semantic == null) {
      log.warn("No query vector available, semantic search degrades to keyword ranking");
    }

    transition(key, SearchState.FUSING);
    List<ScoredResult> results =
        fuse(
            semanticAvailable ? semantic.hits() : List.of(),
            keyword != null ? keyword : List.of(),
            semanticWeight,
            keywordWeight,
            terms,
            query,
            limit,
            degraded);

    if (degraded || keywordMissing) {
      meterRegistry.counter("rag.search.cache.skipped").increment();
      log.debug("Query {} returned partial results, not caching them", abbreviate(key));
    } else {
      writeCache(key, results, generation);
      transition(key, SearchState.CACHED);
    }
    return results;
  }

  /**
   * Finds chunks of other documents similar to a document, using the stored vector of its first
   * chunk. Hits below the relevance floor are dropped.
   *
   * @param documentId the source document
   * @param limit maximum number of results
   * @return similar chunks ordered by similarity, empty when the document has no chunks
   * @throws ValidationException when the limit is rejected
   * @throws IndexStoreException when the index store fails
   */
  @Timed(value = "rag.similar", description = "Time to find similar documents")
  public List<ScoredResult> findSimilar(String documentId, int limit) {
    validateLimit(limit);
    List<DocumentChunk> documentChunks = chunkIndexStore.getChunksByDocument(documentId);
    if (documentChunks.isEmpty()) {
      log.debug("Document {} has no chunks, no similar documents", documentId);
      return List.of();
    }
    DocumentChunk first = documentChunks.get(0);
    if (first.getEmbedding() == null || first.getEmbedding().isEmpty()) {
      return List.of();
    }

    EmbeddingSource source = first.getEmbeddingSource();
    int candidates = limit + documentChunks.size();
    Map<String, Double> similarities = new LinkedHashMap<>();
    double floor = ragConfig.getRetrieval().getMinRelevanceScore();
    List<SemanticHit> hits =
        chunkIndexStore.nearestNeighbors(first.getEmbedding(), source, candidates);
    for (SemanticHit hit : hits) {
      if (hit.similarity() >= floor) {
        similarities.putIfAbsent(hit.chunkId(), hit.similarity());
      }
    }
    if (similarities.isEmpty()) {
      return List.of();
    }

    List<String> sourceTerms =
        first.getKeywords() != null ? List.copyOf(first.getKeywords()) : List.of();
    int contextWindow = ragConfig.getRetrieval().getContextWindow();
    List<ScoredResult> similar = new ArrayList<>();
    for (DocumentChunk chunk : chunkIndexStore.getChunks(similarities.keySet())) {
      if (documentId.equals(chunk.getDocumentId())) {
        continue;
      }
      double similarity = similarities.get(chunk.getId());
      similar.add(
          new ScoredResult(
              chunk.getId(),
              chunk.getDocumentId(),
              chunk.getFileName(),
              chunk.getChunkIndex(),
              chunk.getContent(),
              similarity,
              0.0,
              similarity,
              similarity,
              matchedKeywords(chunk, sourceTerms, null),
              ContextWindowExtractor.extract(chunk.getContent(), sourceTerms, contextWindow),
              source == EmbeddingSource.FALLBACK));
    }
    similar.sort(
        Comparator.comparingDouble(ScoredResult::fusedScore)
            .reversed()
            .thenComparing(ScoredResult::documentId)
            .thenComparingInt(ScoredResult::chunkIndex));
    return similar.size() > limit ? List.copyOf(similar.subList(0, limit)) : similar;
  }

  /**
   * Suggests index keywords for a partially typed query. The complete words of the query are
   * matched against the index and the keywords of the matching chunks that contain the last word
   * are returned, prefix matches first.
   *
   * @param partialQuery text typed so far
   * @param limit maximum number of suggestions
   * @return suggestions, empty for input shorter than two characters
   * @throws ValidationException when the input or limit is rejected
   * @throws IndexStoreException when the index store fails
   */
  public List<String> suggest(String partialQuery, int limit) {
    validateLimit(limit);
    if (partialQuery == null || partialQuery.strip().length() < MIN_SUGGESTION_LENGTH) {
      return List.of();
    }
    if (partialQuery.length() > ragConfig.getRetrieval().getMaxQueryLength()) {
      throw new ValidationException(
          "q",
          "Query must be at most "
              + ragConfig.getRetrieval().getMaxQueryLength()
              + " characters");
    }
    List<String> words = queryWords(partialQuery);
    String fragment = words.get(words.size() - 1);
    List<String> terms = keywordExtractor.queryTerms(partialQuery);
    if (terms.isEmpty()) {
      return List.of();
    }

    Set<String> candidates = new TreeSet<>();
    List<KeywordHit> hits = chunkIndexStore.keywordSearch(terms, SUGGESTION_CANDIDATES);
    hits.forEach(hit -> candidates.addAll(hit.matchedTerms()));
    List<String> hitIds = hits.stream().map(KeywordHit::chunkId).toList();
    for (DocumentChunk chunk : chunkIndexStore.getChunks(hitIds)) {
      if (chunk.getKeywords() != null) {
        candidates.addAll(chunk.getKeywords());
      }
    }
    return candidates.stream()
        .filter(candidate -> candidate.contains(fragment))
        .sorted(
            Comparator.comparing((String candidate) -> !candidate.startsWith(fragment))
                .thenComparing(Comparator.naturalOrder()))
        .limit(limit)
        .toList();
  }

  private SemanticOutcome runSemanticLeg(String query, int candidates) {
    Optional<EmbeddingBatch> embedded = embeddingService.embedQuery(query, queryEmbeddingBudget());
    if (embedded.isEmpty()) {
      return null;
    }
    EmbeddingBatch batch = embedded.get();
    List<SemanticHit> hits =
        chunkIndexStore.nearestNeighbors(batch.vector(0), batch.source(), candidates);
    return new SemanticOutcome(hits, batch.isFallback());
  }

  private List<ScoredResult> fuse(
      List<SemanticHit> semanticHits,
      List<KeywordHit> keywordHits,
      double semanticWeight,
      double keywordWeight,
      List<String> terms,
      String query,
      int limit,
      boolean degraded) {
    Map<String, Double> semanticScores = new LinkedHashMap<>();
    semanticHits.forEach(hit -> semanticScores.merge(hit.chunkId(), hit.similarity(), Math::max));
    Map<String, Double> keywordScores = new LinkedHashMap<>();
    Map<String, List<String>> matchedTerms = new HashMap<>();
    for (KeywordHit hit : keywordHits) {
      keywordScores.merge(hit.chunkId(), hit.matchScore(), Math::max);
      matchedTerms.put(hit.chunkId(), hit.matchedTerms());
    }

    Map<String, Double> normalizedSemantic = normalize(semanticScores);
    Map<String, Double> normalizedKeyword = normalize(keywordScores);
    TreeSet<String> candidateIds = new TreeSet<>(semanticScores.keySet());
    candidateIds.addAll(keywordScores.keySet());
    if (candidateIds.isEmpty()) {
      return List.of();
    }

    Map<String, DocumentChunk> chunks = new HashMap<>();
    for (DocumentChunk chunk : chunkIndexStore.getChunks(candidateIds)) {
      chunks.put(chunk.getId(), chunk);
    }

    RagConfig.Retrieval settings = ragConfig.getRetrieval();
    List<ScoredResult> ranked = new ArrayList<>();
    List<String> windowTerms = terms.isEmpty() ? queryWords(query) : terms;
    String normalizedQuery = normalizeQuery(query);
    for (String chunkId : candidateIds) {
      DocumentChunk chunk = chunks.get(chunkId);
      if (chunk == null) {
        log.debug("Dropping hit {} with no stored chunk", chunkId);
        continue;
      }
      double fused =
          semanticWeight * normalizedSemantic.getOrDefault(chunkId, 0.0)
              + keywordWeight * normalizedKeyword.getOrDefault(chunkId, 0.0);
      if (fused < settings.getMinRelevanceScore()) {
        continue;
      }
      List<String> matched = matchedKeywords(chunk, terms, matchedTerms.get(chunkId));
      double relevance =
          settings.isRankingBoost()
              ? fused * rankingBoost(chunk.getContent(), normalizedQuery, windowTerms, matched)
              : fused;
      ranked.add(
          new ScoredResult(
              chunkId,
              chunk.getDocumentId(),
              chunk.getFileName(),
              chunk.getChunkIndex(),
              chunk.getContent(),
              semanticScores.getOrDefault(chunkId, 0.0),
              keywordScores.getOrDefault(chunkId, 0.0),
              fused,
              relevance,
              matched,
              null,
              degraded));
    }

    ranked.sort(
        Comparator.comparingDouble(ScoredResult::relevanceScore)
            .reversed()
            .thenComparing(Comparator.comparingDouble(ScoredResult::fusedScore).reversed())
            .thenComparingInt(ScoredResult::chunkIndex)
            .thenComparing(ScoredResult::chunkId));

    int contextWindow = settings.getContextWindow();
    return ranked.stream()
        .limit(limit)
        .map(
            result ->
                new ScoredResult(
                    result.chunkId(),
                    result.documentId(),
                    result.fileName(),
                    result.chunkIndex(),
                    result.content(),
                    result.semanticScore(),
                    result.keywordScore(),
                    result.fusedScore(),
                    result.relevanceScore(),
                    result.matchedKeywords(),
                    ContextWindowExtractor.extract(result.content(), windowTerms, contextWindow),
                    result.degraded()))
        .toList();
  }

  /**
   * Min-max normalization anchored at zero: scores are divided by the leg's maximum, negative
   * scores count as 0. A lone positive candidate, or several with equal scores, get 1.0.
   */
  @VisibleForTesting
  static Map<String, Double> normalize(Map<String, Double> scores) {
    double max = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0);
    Map<String, Double> normalized = new HashMap<>();
    scores.forEach(
        (id, score) -> normalized.put(id, max > 0 ? Math.max(0, score) / max : 0.0));
    return normalized;
  }

  /**
   * Multiplier applied to the fused score for ordering: 1.2 when the whole query appears in the
   * content, {@code 1 + 0.1 * n} when more than one query term matched, and 1.1 when a query term
   * appears in the first 100 characters.
   */
  @VisibleForTesting
  static double rankingBoost(
      String content, String normalizedQuery, List<String> queryTerms, List<String> matched) {
    String lowerContent = content.toLowerCase(Locale.ROOT);
    double boost = 1.0;
    if (!normalizedQuery.isEmpty() && lowerContent.contains(normalizedQuery)) {
      boost *= 1.2;
    }
    if (matched.size() > 1) {
      boost *= 1 + 0.1 * matched.size();
    }
    String opening = lowerContent.substring(0, Math.min(EARLY_MATCH_CHARS, lowerContent.length()));
    if (queryTerms.stream().anyMatch(opening::contains)) {
      boost *= 1.1;
    }
    return boost;
  }

  private static List<String> matchedKeywords(
      DocumentChunk chunk, List<String> terms, List<String> keywordLegTerms) {
    TreeSet<String> matched = new TreeSet<>();
    if (keywordLegTerms != null) {
      matched.addAll(keywordLegTerms);
    }
    if (chunk.getKeywords() != null) {
      terms.stream().filter(chunk.getKeywords()::contains).forEach(matched::add);
    }
    return List.copyOf(matched);
  }

  private void validate(String query, int limit) {
    RagConfig.Retrieval settings = ragConfig.getRetrieval();
    if (query == null || query.isBlank()) {
      throw new ValidationException("query", "Query must not be empty");
    }
    if (query.length() > settings.getMaxQueryLength()) {
      throw new ValidationException(
          "query", "Query must be at most " + settings.getMaxQueryLength() + " characters");
    }
    validateLimit(limit);
  }

  private void validateLimit(int limit) {
    int maxResults = ragConfig.getRetrieval().getMaxResults();
    if (limit < 1 || limit > maxResults) {
      throw new ValidationException("limit", "Limit must be between 1 and " + maxResults);
    }
  }

  @VisibleForTesting
  String cacheKey(String query, SearchMode mode, int limit) {
    RagConfig.Retrieval settings = ragConfig.getRetrieval();
    return Fingerprints.sha256(
        String.join(
            "|",
            normalizeQuery(query),
            mode.name(),
            String.valueOf(limit),
            String.valueOf(settings.getSemanticWeight()),
            String.valueOf(settings.getKeywordWeight()),
            String.valueOf(settings.getOverFetchMultiplier()),
            String.valueOf(settings.getMinRelevanceScore()),
            String.valueOf(settings.isRankingBoost())));
  }

  private static String normalizeQuery(String query) {
    return WHITESPACE.matcher(query.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
  }

  /** Primary budget for query embeddings; leaves half the leg for the fallback and the lookup. */
  private Duration queryEmbeddingBudget() {
    Duration halfLeg = ragConfig.getRetrieval().getLegTimeout().dividedBy(2);
    Duration configured = ragConfig.getEmbedding().getQueryTimeout();
    return configured.compareTo(halfLeg) < 0 ? configured : halfLeg;
  }

  private long readGeneration() {
    try {
      return searchCache.generation();
    } catch (RuntimeException e) {
      log.warn("Search cache generation unavailable: {}", e.getMessage());
      return 0;
    }
  }

  private Optional<List<ScoredResult>> readCache(String key) {
    try {
      return searchCache.get(key).map(CacheEntry::results);
    } catch (RuntimeException e) {
      log.warn("Search cache read failed, treating as miss: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private void writeCache(String key, List<ScoredResult> results, long generation) {
    try {
      searchCache.put(key, results, generation);
    } catch (RuntimeException e) {
      log.warn("Search cache write failed, result not cached: {}", e.getMessage());
    }
  }

  private <T> Future<T> submit(Callable<T> leg) {
    try {
      return searchExecutor.getThreadPoolExecutor().submit(leg);
    } catch (RejectedExecutionException e) {
      throw new SearchException("Search executor is saturated", e);
    }
  }

  private <T> T await(Future<T> leg, long deadlineNanos, String name)
      throws InterruptedException {
    if (leg == null) {
      return null;
    }
    try {
      return leg.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      leg.cancel(true);
      meterRegistry.counter("rag.search.leg.timeout", "leg", name).increment();
      log.warn("{} leg timed out, continuing without it", name);
      return null;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IndexStoreException indexStoreException) {
        throw indexStoreException;
      }
      throw new SearchException(name + " leg failed: " + cause.getMessage(), cause);
    }
  }

  private static void cancel(Future<?> leg) {
    if (leg != null) {
      leg.cancel(true);
    }
  }

  private long followerTimeoutMillis() {
    return ragConfig.getRetrieval().getLegTimeout().multipliedBy(3).toMillis();
  }

  private static List<String> queryWords(String query) {
    return List.of(WHITESPACE.split(query.trim().toLowerCase(Locale.ROOT)));
  }

  private static void transition(String key, SearchState state) {
    log.debug("Query {} -> {}", abbreviate(key), state);
  }

  private static String abbreviate(String key) {
    return key.substring(0, Math.min(12, key.length()));
  }
}
