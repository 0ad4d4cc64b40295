package com.flamingo.ai.docsearch.service.rag.embedding;

import com.flamingo.ai.docsearch.domain.enums.EmbeddingSource;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Primary tier: the remote OpenAI embedding model. */
@Component("primaryEmbeddingProvider")
@Slf4j
public class OpenAiEmbeddingProvider extends LangChain4jEmbeddingProvider {

  // text-embedding-3-small accepts 8192 tokens; dense CJK text can approach 1 char per token
  static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final int dimension;

  public OpenAiEmbeddingProvider(
      @Qualifier("primaryEmbeddingModel") EmbeddingModel embeddingModel,
      @Value("${langchain4j.openai.embedding-model.dimensions:1536}") int dimension) {
    super(embeddingModel);
    this.dimension = dimension;
  }

  @Override
  protected String prepare(String text) {
    if (text.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          text.length(),
          MAX_CHARS_PER_EMBEDDING);
      return text.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    return text;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public EmbeddingSource source() {
    return EmbeddingSource.PRIMARY;
  }
}
