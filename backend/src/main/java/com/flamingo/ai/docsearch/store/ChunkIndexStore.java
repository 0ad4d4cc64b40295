package com.flamingo.ai.docsearch.store;

import com.flamingo.ai.docsearch.domain.enums.EmbeddingSource;
import com.flamingo.ai.docsearch.elasticsearch.DocumentChunk;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistent store of document chunks supporting vector and keyword lookup.
 *
 * <p>Implementations are safe for concurrent use and never return hits for chunks that do not
 * exist. Every failure to reach or use the backing store is raised as {@link
 * com.flamingo.ai.docsearch.exception.IndexStoreException}.
 */
public interface ChunkIndexStore {

  /**
   * Inserts or replaces chunks by id.
   *
   * @param chunks the chunks to store
   */
  void upsertChunks(List<DocumentChunk> chunks);

  /**
   * Finds the chunks whose vectors are closest to {@code vector}, considering only chunks embedded
   * by the same provider tier.
   *
   * @param vector the query vector
   * @param source provider tier of the query vector
   * @param k maximum number of hits
   * @return hits ordered by descending similarity
   */
  List<SemanticHit> nearestNeighbors(List<Float> vector, EmbeddingSource source, int k);

  /**
   * Finds the chunks matching any of the given normalized terms.
   *
   * @param terms normalized query terms
   * @param k maximum number of hits
   * @return hits ordered by descending match score
   */
  List<KeywordHit> keywordSearch(List<String> terms, int k);

  Optional<DocumentChunk> getChunk(String chunkId);

  /**
   * Loads several chunks at once. Unknown ids are skipped.
   *
   * @param chunkIds ids to load
   * @return the chunks found, in no particular order
   */
  List<DocumentChunk> getChunks(Collection<String> chunkIds);

  /**
   * Returns all chunks of a document ordered by chunk index.
   *
   * @param documentId the document id
   * @return the chunks, empty if none
   */
  List<DocumentChunk> getChunksByDocument(String documentId);

  /**
   * Removes every chunk of a document.
   *
   * @param documentId the document id
   */
  void deleteDocument(String documentId);

  long countChunks();
}
