package com.flamingo.ai.docsearch.service.rag.embedding;

import com.flamingo.ai.docsearch.domain.enums.EmbeddingSource;
import com.flamingo.ai.docsearch.exception.EmbeddingProviderException;
import java.util.List;

/** Turns texts into fixed-length vectors. */
public interface EmbeddingProvider {

  /**
   * Embeds a batch of texts.
   *
   * @param texts texts to embed
   * @return one vector per input text, in input order, each of {@link #dimension()} length
   * @throws EmbeddingProviderException when the provider fails or returns a malformed result
   */
  List<List<Float>> embed(List<String> texts);

  /** Length of every vector this provider returns. */
  int dimension();

  /** Tier used to tag stored vectors. */
  EmbeddingSource source();
}
