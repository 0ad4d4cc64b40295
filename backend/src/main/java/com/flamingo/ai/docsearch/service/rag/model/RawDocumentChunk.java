package com.flamingo.ai.docsearch.service.rag.model;

/**
 * A single chunk produced by a {@link
 * com.flamingo.ai.docsearch.service.rag.chunking.DocumentChunker}, before keyword extraction,
 * embedding or indexing.
 *
 * @param content the full chunk text, including the overlap prefix
 * @param chunkIndex sequential position of this chunk within the document (0-based)
 * @param overlapLength number of leading characters of {@code content} repeated from the previous
 *     chunk (prefix plus separator); 0 for the first chunk
 */
public record RawDocumentChunk(String content, int chunkIndex, int overlapLength) {

  /** Returns the chunk text without the overlap prefix. */
  public String body() {
    return content.substring(overlapLength);
  }
}
