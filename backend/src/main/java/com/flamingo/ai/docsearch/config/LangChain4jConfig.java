package com.flamingo.ai.docsearch.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j embedding models behind the two provider tiers. */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LangChain4jConfig {

  private final RagConfig ragConfig;

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  /** Remote model used for every batch until it keeps failing. */
  @Bean
  public EmbeddingModel primaryEmbeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(ragConfig.getEmbedding().getTimeout())
        .maxRetries(0)
        .build();
  }

  /** In-process all-MiniLM-L6-v2 model (384 dimensions), no network involved. */
  @Bean
  public EmbeddingModel localEmbeddingModel() {
    log.info("Loading local fallback embedding model all-MiniLM-L6-v2");
    return new AllMiniLmL6V2EmbeddingModel();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
