package com.flamingo.ai.docsearch.service.rag.embedding;

import com.flamingo.ai.docsearch.domain.enums.EmbeddingSource;
import java.util.List;

/**
 * Vectors for a batch of texts, all produced by the same provider tier.
 *
 * @param vectors one vector per input text, in input order
 * @param source tier that produced every vector of the batch
 */
public record EmbeddingBatch(List<List<Float>> vectors, EmbeddingSource source) {

  public List<Float> vector(int index) {
    return vectors.get(index);
  }

  public int dimension() {
    return vectors.isEmpty() ? 0 : vectors.get(0).size();
  }

  public boolean isFallback() {
    return source == EmbeddingSource.FALLBACK;
  }
}
