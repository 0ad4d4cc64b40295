package com.flamingo.ai.docsearch.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Thread pools for query fan-out, query embedding and batch embedding. */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

  private final RagConfig ragConfig;

  /** Runs the semantic and keyword legs of a query concurrently. */
  @Bean(name = "searchExecutor")
  public ThreadPoolTaskExecutor searchExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("search-");
    executor.initialize();
    return executor;
  }

  /** Runs the bounded primary attempt of a query embedding. */
  @Bean(name = "queryEmbeddingExecutor")
  public ThreadPoolTaskExecutor queryEmbeddingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("query-embed-");
    executor.initialize();
    return executor;
  }

  /** Embeds chunk batches during ingestion; bounded so providers are not flooded. */
  @Bean(name = "embeddingExecutor")
  public ThreadPoolTaskExecutor embeddingExecutor() {
    int poolSize = Math.max(1, ragConfig.getEmbedding().getWorkerPoolSize());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }
}
