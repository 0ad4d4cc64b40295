package com.flamingo.ai.docsearch.elasticsearch;

import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import java.util.List;

/**
 * Generic index-management operations shared by Elasticsearch-backed stores.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T> {

  /**
   * Initializes the index with appropriate mappings.
   *
   * <p>Creates the index if it doesn't exist, using the schema defined by the implementation.
   */
  void initIndex();

  /**
   * Indexes multiple documents in bulk, replacing documents with the same id.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Deletes documents matching the given query and refreshes the index.
   *
   * @param query the delete criteria
   */
  void deleteBy(Query query);

  /**
   * Refreshes the index to make recent changes visible for search.
   *
   * <p>Called after bulk indexing so documents are immediately searchable.
   */
  void refresh();

  /**
   * Counts the documents in the index.
   *
   * @return the document count
   */
  long count();

  /**
   * Gets the name of the Elasticsearch index.
   *
   * @return the index name
   */
  String getIndexName();
}
