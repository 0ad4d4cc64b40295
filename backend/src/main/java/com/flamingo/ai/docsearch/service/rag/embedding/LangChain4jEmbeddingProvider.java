package com.flamingo.ai.docsearch.service.rag.embedding;

import com.flamingo.ai.docsearch.exception.EmbeddingProviderException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Base for providers backed by a LangChain4j {@link EmbeddingModel}. Failures of the model are
 * reported as {@link EmbeddingProviderException} and every result is checked for count and
 * dimension.
 */
@Slf4j
abstract class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  private final EmbeddingModel embeddingModel;

  protected LangChain4jEmbeddingProvider(EmbeddingModel embeddingModel) {
    this.embeddingModel = embeddingModel;
  }

  /** Hook for per-provider input limits. */
  protected String prepare(String text) {
    return text;
  }

  @Override
  public List<List<Float>> embed(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (String text : texts) {
      segments.add(TextSegment.from(prepare(text)));
    }

    Response<List<Embedding>> response;
    try {
      response = embeddingModel.embedAll(segments);
    } catch (RuntimeException e) {
      throw new EmbeddingProviderException(
          source() + " embedding call failed: " + e.getMessage(), e, isRateLimit(e));
    }

    List<Embedding> embeddings = response == null ? null : response.content();
    if (embeddings == null || embeddings.size() != texts.size()) {
      throw new EmbeddingProviderException(
          source()
              + " provider returned "
              + (embeddings == null ? 0 : embeddings.size())
              + " vectors for "
              + texts.size()
              + " texts");
    }

    List<List<Float>> vectors = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      float[] vector = embedding.vector();
      if (vector.length != dimension()) {
        throw new EmbeddingProviderException(
            source() + " provider returned " + vector.length + " dimensions, expected "
                + dimension());
      }
      vectors.add(toFloatList(vector));
    }
    log.debug("{} provider embedded {} texts", source(), texts.size());
    return vectors;
  }

  private static boolean isRateLimit(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      String message = t.getMessage();
      if (message != null) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("429") || lower.contains("rate limit")) {
          return true;
        }
      }
    }
    return false;
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
