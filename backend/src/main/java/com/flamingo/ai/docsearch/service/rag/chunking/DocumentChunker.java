package com.flamingo.ai.docsearch.service.rag.chunking;

import com.flamingo.ai.docsearch.config.RagConfig;
import com.flamingo.ai.docsearch.service.rag.model.RawDocumentChunk;
import java.util.List;

/**
 * Splits document text into an ordered list of overlapping {@link RawDocumentChunk}s ready for
 * keyword extraction and embedding.
 *
 * <p>Implementations must be stateless and safe for concurrent use. A chunker only chunks; it does
 * not clean, embed or index.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from plain text.
   *
   * @param text the cleaned document text
   * @param settings chunk size, overlap and hard limit
   * @return ordered list of chunks; empty for blank text
   * @throws IllegalArgumentException if the overlap is not smaller than the chunk size
   */
  List<RawDocumentChunk> chunk(String text, RagConfig.Chunking settings);
}
