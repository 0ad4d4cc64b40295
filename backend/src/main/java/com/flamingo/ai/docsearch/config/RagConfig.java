package com.flamingo.ai.docsearch.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion and retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private IndexStore indexStore = new IndexStore();
  private Chunking chunking = new Chunking();
  private Keywords keywords = new Keywords();
  private Ingestion ingestion = new Ingestion();
  private Retrieval retrieval = new Retrieval();
  private Embedding embedding = new Embedding();
  private Cache cache = new Cache();

  @Getter
  @Setter
  public static class IndexStore {
    /** Backing store for chunks: "elasticsearch" (default) or "memory". */
    private String type = "elasticsearch";
  }

  @Getter
  @Setter
  public static class Chunking {
    /** Target chunk size in characters. */
    private int size = 1000;

    /** Characters of the previous chunk repeated at the start of the next one. */
    private int overlap = 200;

    /** A single sentence longer than this is cut by characters. */
    private int hardLimit = 4000;
  }

  @Getter
  @Setter
  public static class Keywords {
    private int maxPerChunk = 20;

    /** Domain vocabulary whose occurrences count extra when ranking a chunk's keywords. */
    private List<String> boostedTerms = new ArrayList<>();

    private int boostedTermBonus = 5;
  }

  @Getter
  @Setter
  public static class Ingestion {
    /** Documents with more characters than this are rejected. */
    private int maxDocumentChars = 5_000_000;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private double semanticWeight = 0.7;
    private double keywordWeight = 0.3;

    /** Each leg fetches {@code limit * overFetchMultiplier} candidates before fusion. */
    private int overFetchMultiplier = 3;

    private Duration legTimeout = Duration.ofSeconds(10);

    /** Results whose fused score falls below this are dropped. */
    private double minRelevanceScore = 0.1;

    /** Reorders fused results by phrase, keyword-count and early-position matches. */
    private boolean rankingBoost = true;

    /** Characters of context returned around the best query-term match. */
    private int contextWindow = 200;

    private int maxQueryLength = 500;
    private int maxResults = 50;
    private int defaultLimit = 10;
  }

  @Getter
  @Setter
  public static class Embedding {
    private Duration timeout = Duration.ofSeconds(30);

    /** Wait for the primary provider when embedding a query before using the fallback. */
    private Duration queryTimeout = Duration.ofSeconds(2);
    private int maxRetryAttempts = 3;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
    private int batchSize = 10;
    private int workerPoolSize = 4;
    private long cacheMaxEntries = 10_000;
  }

  @Getter
  @Setter
  public static class Cache {
    private int retentionHours = 24;
    private Duration evictionInterval = Duration.ofMinutes(10);
  }
}
