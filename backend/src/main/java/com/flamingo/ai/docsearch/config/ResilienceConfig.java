package com.flamingo.ai.docsearch.config;

import com.flamingo.ai.docsearch.exception.EmbeddingProviderException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Retry policy for the primary embedding provider. */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ResilienceConfig {

  private static final double BACKOFF_JITTER = 0.5;

  private final RagConfig ragConfig;

  @Bean
  public Retry embeddingRetry() {
    return buildEmbeddingRetry(ragConfig.getEmbedding());
  }

  /**
   * Builds the jittered exponential-backoff retry used around primary embedding calls.
   *
   * @param settings embedding settings (attempts, initial backoff, multiplier)
   * @return the retry instance
   */
  public static Retry buildEmbeddingRetry(RagConfig.Embedding settings) {
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(Math.max(1, settings.getMaxRetryAttempts()))
            .intervalFunction(
                IntervalFunction.ofExponentialRandomBackoff(
                    settings.getInitialBackoff(),
                    settings.getBackoffMultiplier(),
                    BACKOFF_JITTER))
            .retryExceptions(EmbeddingProviderException.class)
            .build();
    Retry retry = Retry.of("embedding-primary", config);
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Primary embedding attempt {} failed, retrying in {}: {}",
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval(),
                    event.getLastThrowable() != null
                        ? event.getLastThrowable().getMessage()
                        : "unknown"));
    return retry;
  }
}
