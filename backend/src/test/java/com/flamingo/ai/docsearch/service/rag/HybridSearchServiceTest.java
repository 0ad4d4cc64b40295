package com.flamingo.ai.docsearch.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docsearch.config.RagConfig;
import com.flamingo.ai.docsearch.config.ResilienceConfig;
import com.flamingo.ai.docsearch.domain.enums.EmbeddingSource;
import com.flamingo.ai.docsearch.domain.enums.SearchMode;
import com.flamingo.ai.docsearch.elasticsearch.DocumentChunk;
import com.flamingo.ai.docsearch.exception.CacheException;
import com.flamingo.ai.docsearch.exception.EmbeddingProviderException;
import com.flamingo.ai.docsearch.exception.SearchException;
import com.flamingo.ai.docsearch.exception.ValidationException;
import com.flamingo.ai.docsearch.service.cache.InMemorySearchCache;
import com.flamingo.ai.docsearch.service.cache.SearchCache;
import com.flamingo.ai.docsearch.service.rag.embedding.EmbeddingProvider;
import com.flamingo.ai.docsearch.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docsearch.service.rag.model.ScoredResult;
import com.flamingo.ai.docsearch.store.ChunkIndexStore;
import com.flamingo.ai.docsearch.store.InMemoryChunkIndexStore;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("HybridSearchService Tests")
class HybridSearchServiceTest {

  private static final List<Float> QUERY_VECTOR = List.of(0.9f, 0.1f, 0f);

  @Mock private EmbeddingProvider primaryProvider;
  @Mock private EmbeddingProvider fallbackProvider;

  private final CountDownLatch releaseEmbedding = new CountDownLatch(1);

  private RagConfig ragConfig;
  private KeywordExtractor keywordExtractor;
  private InMemoryChunkIndexStore chunkIndexStore;
  private EmbeddingService embeddingService;
  private SimpleMeterRegistry meterRegistry;
  private ThreadPoolTaskExecutor searchExecutor;
  private ThreadPoolTaskExecutor queryEmbeddingExecutor;
  private HybridSearchService searchService;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getRetrieval().setLegTimeout(Duration.ofMillis(500));
    keywordExtractor = new KeywordExtractor(ragConfig);
    meterRegistry = new SimpleMeterRegistry();

    when(primaryProvider.source()).thenReturn(EmbeddingSource.PRIMARY);
    when(primaryProvider.dimension()).thenReturn(3);
    when(primaryProvider.embed(anyList())).thenReturn(List.of(QUERY_VECTOR));
    when(fallbackProvider.source()).thenReturn(EmbeddingSource.FALLBACK);
    when(fallbackProvider.dimension()).thenReturn(3);
    when(fallbackProvider.embed(anyList()))
        .thenThrow(new EmbeddingProviderException("local model unavailable"));

    queryEmbeddingExecutor = new ThreadPoolTaskExecutor();
    queryEmbeddingExecutor.setCorePoolSize(4);
    queryEmbeddingExecutor.setThreadNamePrefix("test-query-embed-");
    queryEmbeddingExecutor.initialize();

    RagConfig.Embedding embeddingSettings = new RagConfig.Embedding();
    embeddingSettings.setMaxRetryAttempts(1);
    embeddingSettings.setInitialBackoff(Duration.ofMillis(10));
    embeddingService =
        new EmbeddingService(
            primaryProvider,
            fallbackProvider,
            ResilienceConfig.buildEmbeddingRetry(embeddingSettings),
            Caffeine.newBuilder().maximumSize(100).build(),
            meterRegistry,
            queryEmbeddingExecutor);

    searchExecutor = new ThreadPoolTaskExecutor();
    searchExecutor.setCorePoolSize(4);
    searchExecutor.setMaxPoolSize(8);
    searchExecutor.setThreadNamePrefix("test-search-");
    searchExecutor.initialize();

    chunkIndexStore = spy(new InMemoryChunkIndexStore(keywordExtractor));
    chunkIndexStore.upsertChunks(
        List.of(
            chunk("doc1", 0, "Climate policy requires international negotiation.", 1f, 0f, 0f),
            chunk("doc1", 1, "Ocean temperatures are rising quickly.", 0f, 1f, 0f),
            chunk("doc2", 0, "Budget planning for the city council.", 0f, 0f, 1f)));

    searchService = newService(chunkIndexStore, new InMemorySearchCache(Clock.systemUTC()));
  }

  @AfterEach
  void tearDown() {
    releaseEmbedding.countDown();
    searchExecutor.shutdown();
    queryEmbeddingExecutor.shutdown();
  }

  @Nested
  @DisplayName("Hybrid ranking")
  class HybridRanking {

    @Test
    @DisplayName("should rank the chunk matching both legs first")
    void shouldRankChunkMatchingBothLegsFirst() {
      // When
      List<ScoredResult> results = searchService.search("climate change", SearchMode.HYBRID, 5);

      // Then
      assertThat(results).isNotEmpty().hasSizeLessThanOrEqualTo(5);
      ScoredResult top = results.get(0);
      assertThat(top.chunkId()).isEqualTo("doc1_0");
      assertThat(top.fusedScore()).isCloseTo(1.0, within(1e-9));
      assertThat(top.matchedKeywords()).containsExactly("climate");
      assertThat(top.contextWindow()).contains("Climate policy");
      assertThat(top.degraded()).isFalse();
      assertThat(results)
          .extracting(ScoredResult::fusedScore)
          .isSortedAccordingTo((a, b) -> Double.compare(b, a));
    }

    @Test
    @DisplayName("should return the same results from cache without searching again")
    void shouldServeRepeatedQueryFromCache() {
      // Given
      List<ScoredResult> first = searchService.search("climate change", SearchMode.HYBRID, 5);

      // When
      List<ScoredResult> second = searchService.search("  Climate   CHANGE ", SearchMode.HYBRID, 5);

      // Then
      assertThat(second).isEqualTo(first);
      verify(chunkIndexStore, times(1)).keywordSearch(anyList(), anyInt());
      verify(primaryProvider, times(1)).embed(anyList());
      assertThat(meterRegistry.counter("rag.search.cache", "result", "hit").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should order equal scores by chunk index then chunk id")
    void shouldBreakTiesDeterministically() {
      // Given
      String content = "Solar panels on municipal roofs.";
      chunkIndexStore.upsertChunks(
          List.of(
              chunk("docA", 2, content, 0f, 0f, 1f),
              chunk("docC", 0, content, 0f, 0f, 1f),
              chunk("docB", 0, content, 0f, 0f, 1f)));

      // When
      List<ScoredResult> results = searchService.search("solar", SearchMode.KEYWORD, 10);

      // Then
      assertThat(results)
          .extracting(ScoredResult::chunkId)
          .containsExactly("docB_0", "docC_0", "docA_2");
      assertThat(results).allSatisfy(r -> assertThat(r.fusedScore()).isEqualTo(1.0));
    }

    @Test
    @DisplayName("should never call the embedding provider in keyword mode")
    void shouldNotEmbed_whenKeywordMode() {
      List<ScoredResult> results = searchService.search("ocean", SearchMode.KEYWORD, 5);

      assertThat(results).extracting(ScoredResult::chunkId).containsExactly("doc1_1");
      assertThat(results.get(0).degraded()).isFalse();
      verify(primaryProvider, never()).embed(anyList());
    }

    @Test
    @DisplayName("should rank by vector similarity only in semantic mode")
    void shouldUseVectorsOnly_whenSemanticMode() {
      List<ScoredResult> results = searchService.search("weather", SearchMode.SEMANTIC, 2);

      assertThat(results).extracting(ScoredResult::chunkId).containsExactly("doc1_0", "doc1_1");
      assertThat(results).allSatisfy(result -> assertThat(result.keywordScore()).isZero());
      assertThat(results.get(0).degraded()).isFalse();
    }

    @Test
    @DisplayName("should order by the boosted score when phrase and position matches differ")
    void shouldApplyRankingBoost_whenOrderingResults() {
      // Given
      chunkIndexStore.upsertChunks(
          List.of(
              chunk("docP", 0, "Solar subsidies expanded this year.", 0f, 0f, 1f),
              chunk(
                  "docQ",
                  0,
                  "Households along the northern river valley received several new municipal"
                      + " grants during the long winter while subsidies for solar panels and"
                      + " solar heaters arrived late.",
                  0f,
                  0f,
                  1f)));

      // When
      List<ScoredResult> results = searchService.search("solar subsidies", SearchMode.KEYWORD, 5);

      // Then
      assertThat(results).extracting(ScoredResult::chunkId).containsExactly("docP_0", "docQ_0");
      ScoredResult phraseMatch = results.get(0);
      ScoredResult laterMatch = results.get(1);
      assertThat(phraseMatch.fusedScore()).isLessThan(laterMatch.fusedScore());
      assertThat(phraseMatch.relevanceScore() / phraseMatch.fusedScore())
          .isCloseTo(1.2 * 1.2 * 1.1, within(1e-9));
      assertThat(laterMatch.relevanceScore() / laterMatch.fusedScore())
          .isCloseTo(1.2, within(1e-9));
    }

    @Test
    @DisplayName("should order by the fused score when the ranking boost is disabled")
    void shouldOrderByFusedScore_whenBoostDisabled() {
      // Given
      ragConfig.getRetrieval().setRankingBoost(false);
      chunkIndexStore.upsertChunks(
          List.of(
              chunk("docP", 0, "Solar subsidies expanded this year.", 0f, 0f, 1f),
              chunk("docQ", 0, "Solar heaters and solar panels need subsidies.", 0f, 0f, 1f)));

      // When
      List<ScoredResult> results = searchService.search("solar subsidies", SearchMode.KEYWORD, 5);

      // Then
      assertThat(results).extracting(ScoredResult::chunkId).containsExactly("docQ_0", "docP_0");
      assertThat(results)
          .allSatisfy(result -> assertThat(result.relevanceScore()).isEqualTo(result.fusedScore()));
    }

    @Test
    @DisplayName("should drop results below the relevance floor")
    void shouldDropResults_whenBelowRelevanceFloor() {
      // When
      List<ScoredResult> filtered = searchService.search("climate", SearchMode.HYBRID, 5);
      ragConfig.getRetrieval().setMinRelevanceScore(0.0);
      List<ScoredResult> unfiltered = searchService.search("climate", SearchMode.HYBRID, 5);

      // Then
      assertThat(filtered).extracting(ScoredResult::chunkId).containsExactly("doc1_0");
      assertThat(unfiltered).extracting(ScoredResult::chunkId).contains("doc1_0", "doc1_1");
      assertThat(filtered)
          .allSatisfy(result -> assertThat(result.fusedScore()).isGreaterThanOrEqualTo(0.1));
    }
  }

  @Nested
  @DisplayName("Degraded search")
  class DegradedSearch {

    @Test
    @DisplayName("should return keyword results when the embedding leg times out")
    void shouldReturnKeywordResults_whenEmbeddingHangs() {
      // Given
      when(primaryProvider.embed(anyList()))
          .thenAnswer(
              invocation -> {
                releaseEmbedding.await(5, TimeUnit.SECONDS);
                return List.of(QUERY_VECTOR);
              });

      // When
      List<ScoredResult> results = searchService.search("climate", SearchMode.HYBRID, 5);

      // Then
      assertThat(results).extracting(ScoredResult::chunkId).containsExactly("doc1_0");
      assertThat(results.get(0).degraded()).isTrue();
      assertThat(results.get(0).semanticScore()).isZero();
      assertThat(results.get(0).fusedScore()).isCloseTo(0.3, within(1e-9));
      assertThat(meterRegistry.counter("embedding.query.timeout").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should rank with a fallback query vector when the primary is slow")
    void shouldUseFallbackVector_whenPrimaryExceedsQueryBudget() {
      // Given
      when(primaryProvider.embed(anyList()))
          .thenAnswer(
              invocation -> {
                releaseEmbedding.await(5, TimeUnit.SECONDS);
                return List.of(QUERY_VECTOR);
              });
      doReturn(List.of(List.of(0f, 0f, 1f))).when(fallbackProvider).embed(anyList());
      DocumentChunk localChunk = chunk("doc3", 0, "Council budget review.", 0f, 0f, 1f);
      localChunk.setEmbeddingSource(EmbeddingSource.FALLBACK);
      chunkIndexStore.upsertChunks(List.of(localChunk));

      // When
      List<ScoredResult> results =
          searchService.search("council budget", SearchMode.SEMANTIC, 5);

      // Then
      assertThat(results).extracting(ScoredResult::chunkId).containsExactly("doc3_0");
      assertThat(results.get(0).semanticScore()).isGreaterThan(0);
      assertThat(results.get(0).degraded()).isTrue();
      assertThat(meterRegistry.counter("embedding.query.timeout").count()).isEqualTo(1.0);
      assertThat(meterRegistry.counter("rag.search.leg.timeout", "leg", "semantic").count())
          .isZero();
    }

    @Test
    @DisplayName("should start the keyword leg up front in semantic mode and share the deadline")
    void shouldRunKeywordLegConcurrently_whenSemanticModeLosesItsVector() throws Exception {
      // Given
      ragConfig.getRetrieval().setLegTimeout(Duration.ofSeconds(2));
      ragConfig.getEmbedding().setQueryTimeout(Duration.ofSeconds(5));
      when(primaryProvider.embed(anyList()))
          .thenAnswer(
              invocation -> {
                releaseEmbedding.await(5, TimeUnit.SECONDS);
                return List.of(QUERY_VECTOR);
              });
      doAnswer(
              invocation -> {
                releaseEmbedding.await(5, TimeUnit.SECONDS);
                return List.of(List.of(0f, 0f, 1f));
              })
          .when(fallbackProvider)
          .embed(anyList());
      CountDownLatch keywordStarted = new CountDownLatch(1);
      doAnswer(
              invocation -> {
                keywordStarted.countDown();
                return invocation.callRealMethod();
              })
          .when(chunkIndexStore)
          .keywordSearch(anyList(), anyInt());
      ExecutorService caller = Executors.newSingleThreadExecutor();

      try {
        // When
        long started = System.nanoTime();
        Future<List<ScoredResult>> search =
            caller.submit(() -> searchService.search("budget", SearchMode.SEMANTIC, 5));

        // Then
        assertThat(keywordStarted.await(800, TimeUnit.MILLISECONDS)).isTrue();
        List<ScoredResult> results = search.get(10, TimeUnit.SECONDS);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        assertThat(results).extracting(ScoredResult::chunkId).containsExactly("doc2_0");
        assertThat(results.get(0).degraded()).isTrue();
        assertThat(elapsedMillis).isLessThan(3_500);
        assertThat(meterRegistry.counter("rag.search.leg.timeout", "leg", "semantic").count())
            .isEqualTo(1.0);
      } finally {
        caller.shutdownNow();
      }
    }

    @Test
    @DisplayName("should return keyword results when both embedding tiers fail")
    void shouldReturnKeywordResults_whenBothTiersFail() {
      // Given
      when(primaryProvider.embed(anyList()))
          .thenThrow(new EmbeddingProviderException("HTTP 503"));

      // When
      List<ScoredResult> results = searchService.search("ocean temperatures", null, 5);

      // Then
      assertThat(results).extracting(ScoredResult::chunkId).containsExactly("doc1_1");
      assertThat(results.get(0).degraded()).isTrue();
      assertThat(results.get(0).matchedKeywords()).containsExactly("ocean", "temperatures");
    }

    @Test
    @DisplayName("should fall back to keyword ranking in semantic mode without a query vector")
    void shouldRankByKeywords_whenSemanticModeHasNoVector() {
      // Given
      when(primaryProvider.embed(anyList()))
          .thenThrow(new EmbeddingProviderException("HTTP 503"));

      // When
      List<ScoredResult> results = searchService.search("budget", SearchMode.SEMANTIC, 5);

      // Then
      assertThat(results).extracting(ScoredResult::chunkId).containsExactly("doc2_0");
      assertThat(results.get(0).fusedScore()).isEqualTo(1.0);
      assertThat(results.get(0).degraded()).isTrue();
    }

    @Test
    @DisplayName("should mark results degraded when the query was embedded by the fallback")
    void shouldMarkDegraded_whenFallbackVectorUsed() {
      // Given
      when(primaryProvider.embed(anyList()))
          .thenThrow(new EmbeddingProviderException("HTTP 429", null, true));
      doReturn(List.of(List.of(0f, 0f, 1f))).when(fallbackProvider).embed(anyList());
      DocumentChunk localChunk = chunk("doc3", 0, "Council budget review.", 0f, 0f, 1f);
      localChunk.setEmbeddingSource(EmbeddingSource.FALLBACK);
      chunkIndexStore.upsertChunks(List.of(localChunk));

      // When
      List<ScoredResult> results = searchService.search("budget", SearchMode.HYBRID, 5);

      // Then
      assertThat(results.get(0).chunkId()).isEqualTo("doc3_0");
      assertThat(results).allSatisfy(result -> assertThat(result.degraded()).isTrue());
    }

    @Test
    @DisplayName("should ignore search cache failures")
    void shouldIgnoreCacheFailures() {
      // Given
      SearchCache brokenCache = mock(SearchCache.class);
      when(brokenCache.get(anyString())).thenThrow(new CacheException("read failed", null));
      when(brokenCache.generation()).thenThrow(new CacheException("read failed", null));
      doThrow(new CacheException("write failed", null))
          .when(brokenCache)
          .put(anyString(), any(), anyLong());
      HybridSearchService service = newService(chunkIndexStore, brokenCache);

      // When
      List<ScoredResult> results = service.search("climate", SearchMode.KEYWORD, 5);

      // Then
      assertThat(results).extracting(ScoredResult::chunkId).containsExactly("doc1_0");
    }
  }

  @Nested
  @DisplayName("Result caching")
  class ResultCaching {

    @Test
    @DisplayName("should not cache degraded results so a recovered provider is used next time")
    void shouldNotCacheDegradedResults_whenPrimaryRecovers() {
      // Given
      when(primaryProvider.embed(anyList()))
          .thenThrow(new EmbeddingProviderException("HTTP 503"))
          .thenReturn(List.of(QUERY_VECTOR));
      List<ScoredResult> whileDown = searchService.search("climate change", SearchMode.HYBRID, 5);

      // When
      List<ScoredResult> afterRecovery =
          searchService.search("climate change", SearchMode.HYBRID, 5);

      // Then
      assertThat(whileDown.get(0).degraded()).isTrue();
      assertThat(whileDown.get(0).semanticScore()).isZero();
      assertThat(afterRecovery.get(0).chunkId()).isEqualTo("doc1_0");
      assertThat(afterRecovery.get(0).degraded()).isFalse();
      assertThat(afterRecovery.get(0).semanticScore()).isGreaterThan(0);
      assertThat(meterRegistry.counter("rag.search.cache.skipped").count()).isEqualTo(1.0);
      assertThat(meterRegistry.counter("rag.search.cache", "result", "hit").count()).isZero();
    }

    @Test
    @DisplayName("should not cache results when the keyword leg timed out")
    void shouldNotCacheResults_whenKeywordLegTimesOut() {
      // Given
      doAnswer(
              invocation -> {
                releaseEmbedding.await(5, TimeUnit.SECONDS);
                return invocation.callRealMethod();
              })
          .when(chunkIndexStore)
          .keywordSearch(anyList(), anyInt());

      // When
      List<ScoredResult> results = searchService.search("climate", SearchMode.HYBRID, 5);

      // Then
      assertThat(results).extracting(ScoredResult::chunkId).containsExactly("doc1_0");
      assertThat(results.get(0).keywordScore()).isZero();
      assertThat(meterRegistry.counter("rag.search.cache.skipped").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should recompute after an index change that lands during a search")
    void shouldRecompute_whenIndexChangesDuringSearch() throws Exception {
      // Given
      ragConfig.getRetrieval().setLegTimeout(Duration.ofSeconds(10));
      ragConfig.getEmbedding().setQueryTimeout(Duration.ofSeconds(5));
      InMemorySearchCache searchCache = new InMemorySearchCache(Clock.systemUTC());
      HybridSearchService service = newService(chunkIndexStore, searchCache);
      CountDownLatch embeddingStarted = new CountDownLatch(1);
      when(primaryProvider.embed(anyList()))
          .thenAnswer(
              invocation -> {
                embeddingStarted.countDown();
                releaseEmbedding.await(5, TimeUnit.SECONDS);
                return List.of(QUERY_VECTOR);
              });
      ExecutorService caller = Executors.newSingleThreadExecutor();

      try {
        // When
        Future<List<ScoredResult>> inFlightSearch =
            caller.submit(() -> service.search("climate", SearchMode.HYBRID, 5));
        assertThat(embeddingStarted.await(5, TimeUnit.SECONDS)).isTrue();
        chunkIndexStore.upsertChunks(
            List.of(chunk("doc4", 0, "Climate finance for island states.", 0.8f, 0.2f, 0f)));
        searchCache.clear();
        releaseEmbedding.countDown();
        inFlightSearch.get(10, TimeUnit.SECONDS);
        List<ScoredResult> afterIngest = service.search("climate", SearchMode.HYBRID, 5);

        // Then
        assertThat(afterIngest).extracting(ScoredResult::chunkId).contains("doc1_0", "doc4_0");
        verify(chunkIndexStore, times(2)).keywordSearch(anyList(), anyInt());
        assertThat(meterRegistry.counter("rag.search.cache", "result", "hit").count()).isZero();
        assertThat(searchCache.size()).isEqualTo(1);
      } finally {
        caller.shutdownNow();
      }
    }
  }

  @Nested
  @DisplayName("Coalescing")
  class Coalescing {

    @Test
    @DisplayName("should compute identical concurrent queries once")
    void shouldShareComputation_whenIdenticalQueriesOverlap() throws Exception {
      // Given
      ragConfig.getRetrieval().setLegTimeout(Duration.ofSeconds(10));
      ragConfig.getEmbedding().setQueryTimeout(Duration.ofSeconds(5));
      CountDownLatch embeddingStarted = new CountDownLatch(1);
      when(primaryProvider.embed(anyList()))
          .thenAnswer(
              invocation -> {
                embeddingStarted.countDown();
                releaseEmbedding.await(5, TimeUnit.SECONDS);
                return List.of(QUERY_VECTOR);
              });
      ExecutorService callers = Executors.newFixedThreadPool(2);

      try {
        // When
        Future<List<ScoredResult>> leader =
            callers.submit(() -> searchService.search("climate", SearchMode.HYBRID, 5));
        assertThat(embeddingStarted.await(5, TimeUnit.SECONDS)).isTrue();
        Future<List<ScoredResult>> follower =
            callers.submit(() -> searchService.search("climate", SearchMode.HYBRID, 5));
        awaitWaiters(2);
        releaseEmbedding.countDown();

        // Then
        List<ScoredResult> leaderResults = leader.get(10, TimeUnit.SECONDS);
        List<ScoredResult> followerResults = follower.get(10, TimeUnit.SECONDS);
        assertThat(followerResults).isEqualTo(leaderResults).isNotEmpty();
        verify(primaryProvider, times(1)).embed(anyList());
        verify(chunkIndexStore, times(1)).keywordSearch(anyList(), anyInt());
        assertThat(meterRegistry.counter("rag.search.coalesced").count()).isEqualTo(1.0);
        assertThat(searchService.inFlightWaiters()).isZero();
      } finally {
        callers.shutdownNow();
      }
    }

    @Test
    @DisplayName("should share failures with waiting callers")
    void shouldPropagateFailure_toFollowers() throws Exception {
      // Given
      ragConfig.getRetrieval().setLegTimeout(Duration.ofSeconds(10));
      ragConfig.getEmbedding().setQueryTimeout(Duration.ofSeconds(5));
      CountDownLatch embeddingStarted = new CountDownLatch(1);
      when(primaryProvider.embed(anyList()))
          .thenAnswer(
              invocation -> {
                embeddingStarted.countDown();
                releaseEmbedding.await(5, TimeUnit.SECONDS);
                return List.of(QUERY_VECTOR);
              });
      doThrow(new SearchException("store unavailable")).when(chunkIndexStore).getChunks(any());

      // When
      CompletableFuture<List<ScoredResult>> leader =
          CompletableFuture.supplyAsync(
              () -> searchService.search("climate", SearchMode.HYBRID, 5));
      assertThat(embeddingStarted.await(5, TimeUnit.SECONDS)).isTrue();
      CompletableFuture<List<ScoredResult>> follower =
          CompletableFuture.supplyAsync(
              () -> searchService.search("climate", SearchMode.HYBRID, 5));
      awaitWaiters(2);
      releaseEmbedding.countDown();

      // Then
      assertThatThrownBy(() -> follower.get(10, TimeUnit.SECONDS))
          .hasCauseInstanceOf(SearchException.class);
      assertThatThrownBy(() -> leader.get(10, TimeUnit.SECONDS))
          .hasCauseInstanceOf(SearchException.class);
      assertThat(meterRegistry.counter("rag.search.failure").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should cancel the legs of an interrupted leader and let a follower recompute")
    void shouldRecomputeOnce_whenLeaderIsInterrupted() throws Exception {
      // Given
      ragConfig.getRetrieval().setLegTimeout(Duration.ofSeconds(10));
      ragConfig.getEmbedding().setQueryTimeout(Duration.ofSeconds(5));
      CountDownLatch embeddingStarted = new CountDownLatch(1);
      CountDownLatch embeddingInterrupted = new CountDownLatch(1);
      AtomicInteger embedCalls = new AtomicInteger();
      when(primaryProvider.embed(anyList()))
          .thenAnswer(
              invocation -> {
                if (embedCalls.incrementAndGet() > 1) {
                  return List.of(QUERY_VECTOR);
                }
                embeddingStarted.countDown();
                try {
                  releaseEmbedding.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                  embeddingInterrupted.countDown();
                  throw new EmbeddingProviderException("interrupted", e);
                }
                return List.of(QUERY_VECTOR);
              });
      ExecutorService callers = Executors.newFixedThreadPool(2);

      try {
        // When
        Future<List<ScoredResult>> leader =
            callers.submit(() -> searchService.search("climate", SearchMode.HYBRID, 5));
        assertThat(embeddingStarted.await(5, TimeUnit.SECONDS)).isTrue();
        Future<List<ScoredResult>> follower =
            callers.submit(() -> searchService.search("climate", SearchMode.HYBRID, 5));
        awaitWaiters(2);
        leader.cancel(true);

        // Then
        assertThat(embeddingInterrupted.await(5, TimeUnit.SECONDS)).isTrue();
        List<ScoredResult> followerResults = follower.get(10, TimeUnit.SECONDS);
        assertThat(followerResults).extracting(ScoredResult::chunkId).containsExactly("doc1_0");
        assertThat(followerResults.get(0).degraded()).isFalse();
        assertThat(embedCalls.get()).isEqualTo(2);
        assertThat(searchService.inFlightWaiters()).isZero();
      } finally {
        callers.shutdownNow();
      }
    }

    private void awaitWaiters(int expected) throws InterruptedException {
      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      while (searchService.inFlightWaiters() < expected && System.nanoTime() < deadline) {
        Thread.sleep(10);
      }
      assertThat(searchService.inFlightWaiters()).isEqualTo(expected);
    }
  }

  @Nested
  @DisplayName("Similar documents and suggestions")
  class SimilarAndSuggestions {

    @Test
    @DisplayName("should find chunks of other documents near the document's first chunk")
    void shouldFindSimilarChunks_fromOtherDocuments() {
      // Given
      chunkIndexStore.upsertChunks(
          List.of(chunk("docS", 0, "Trade policy talks stalled.", 0.8f, 0.6f, 0f)));

      // When
      List<ScoredResult> similar = searchService.findSimilar("doc1", 5);

      // Then
      assertThat(similar).extracting(ScoredResult::chunkId).containsExactly("docS_0");
      assertThat(similar.get(0).fusedScore()).isCloseTo(0.8, within(1e-6));
      assertThat(similar.get(0).matchedKeywords()).containsExactly("policy");
      verify(primaryProvider, never()).embed(anyList());
    }

    @Test
    @DisplayName("should return no similar chunks for a document without chunks")
    void shouldReturnEmpty_whenDocumentHasNoChunks() {
      assertThat(searchService.findSimilar("missing", 5)).isEmpty();
    }

    @Test
    @DisplayName("should suggest index keywords containing the last typed word")
    void shouldSuggestKeywords_forPartialQuery() {
      assertThat(searchService.suggest("climate pol", 5)).containsExactly("policy");
      assertThat(searchService.suggest("Ocean", 5)).containsExactly("ocean");
    }

    @Test
    @DisplayName("should not suggest anything for input shorter than two characters")
    void shouldReturnNoSuggestions_whenInputTooShort() {
      assertThat(searchService.suggest("c", 5)).isEmpty();
      assertThat(searchService.suggest("  ", 5)).isEmpty();
      verify(chunkIndexStore, never()).keywordSearch(anyList(), anyInt());
    }
  }

  @Nested
  @DisplayName("Validation")
  class Validation {

    @Test
    @DisplayName("should reject blank and oversized queries")
    void shouldRejectInvalidQueries() {
      assertThatThrownBy(() -> searchService.search("   ", SearchMode.HYBRID, 5))
          .isInstanceOfSatisfying(
              ValidationException.class, e -> assertThat(e.getField()).isEqualTo("query"));
      assertThatThrownBy(() -> searchService.search("x".repeat(501), SearchMode.HYBRID, 5))
          .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("should reject limits outside the allowed range")
    void shouldRejectInvalidLimits() {
      assertThatThrownBy(() -> searchService.search("climate", SearchMode.HYBRID, 0))
          .isInstanceOfSatisfying(
              ValidationException.class, e -> assertThat(e.getField()).isEqualTo("limit"));
      assertThatThrownBy(() -> searchService.search("climate", SearchMode.HYBRID, 51))
          .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("should report an empty index")
    void shouldThrow_whenIndexIsEmpty() {
      ChunkIndexStore emptyStore = new InMemoryChunkIndexStore(keywordExtractor);
      HybridSearchService service =
          newService(emptyStore, new InMemorySearchCache(Clock.systemUTC()));

      assertThatThrownBy(() -> service.search("climate", SearchMode.HYBRID, 5))
          .isInstanceOfSatisfying(
              SearchException.class,
              e -> assertThat(e.getUserMessage()).contains("No documents"));
    }

    @Test
    @DisplayName("should return no results when nothing matches either leg")
    void shouldReturnEmpty_whenNothingMatches() {
      assertThat(searchService.search("zebra", SearchMode.KEYWORD, 5)).isEmpty();
    }
  }

  @Nested
  @DisplayName("Fingerprints and normalization")
  class FingerprintsAndNormalization {

    @Test
    @DisplayName("should normalize query text in the cache key")
    void shouldNormalizeQueryInCacheKey() {
      String key = searchService.cacheKey("climate change", SearchMode.HYBRID, 5);

      assertThat(searchService.cacheKey("  Climate \t CHANGE", SearchMode.HYBRID, 5))
          .isEqualTo(key);
      assertThat(searchService.cacheKey("climate change", SearchMode.KEYWORD, 5))
          .isNotEqualTo(key);
      assertThat(searchService.cacheKey("climate change", SearchMode.HYBRID, 6))
          .isNotEqualTo(key);
    }

    @Test
    @DisplayName("should change the cache key when fusion weights change")
    void shouldChangeCacheKey_whenWeightsChange() {
      String before = searchService.cacheKey("climate", SearchMode.HYBRID, 5);
      ragConfig.getRetrieval().setSemanticWeight(0.5);

      assertThat(searchService.cacheKey("climate", SearchMode.HYBRID, 5)).isNotEqualTo(before);
    }

    @Test
    @DisplayName("should scale scores by the maximum and clamp negatives")
    void shouldNormalizeByMaximum() {
      Map<String, Double> normalized =
          HybridSearchService.normalize(Map.of("a", 2.0, "b", 1.0, "c", -0.5));

      assertThat(normalized).containsEntry("a", 1.0).containsEntry("b", 0.5);
      assertThat(normalized).containsEntry("c", 0.0);
      assertThat(HybridSearchService.normalize(Map.of("only", 0.2))).containsEntry("only", 1.0);
      assertThat(HybridSearchService.normalize(Map.of())).isEmpty();
    }
  }

  private HybridSearchService newService(ChunkIndexStore store, SearchCache searchCache) {
    return new HybridSearchService(
        store,
        embeddingService,
        keywordExtractor,
        searchCache,
        ragConfig,
        meterRegistry,
        searchExecutor);
  }

  private DocumentChunk chunk(String documentId, int index, String content, Float... vector) {
    return DocumentChunk.builder()
        .id(DocumentChunk.chunkId(documentId, index))
        .documentId(documentId)
        .fileName(documentId + ".txt")
        .chunkIndex(index)
        .content(content)
        .keywords(List.copyOf(keywordExtractor.extract(content)))
        .embedding(List.of(vector))
        .embeddingSource(EmbeddingSource.PRIMARY)
        .embeddingDimension(vector.length)
        .build();
  }
}
