package com.flamingo.ai.docsearch.service.rag.embedding;

import com.flamingo.ai.docsearch.domain.enums.EmbeddingSource;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Fallback tier: all-MiniLM-L6-v2 running in-process. */
@Component("fallbackEmbeddingProvider")
public class LocalEmbeddingProvider extends LangChain4jEmbeddingProvider {

  static final int DIMENSION = 384;

  public LocalEmbeddingProvider(@Qualifier("localEmbeddingModel") EmbeddingModel embeddingModel) {
    super(embeddingModel);
  }

  @Override
  public int dimension() {
    return DIMENSION;
  }

  @Override
  public EmbeddingSource source() {
    return EmbeddingSource.FALLBACK;
  }
}
