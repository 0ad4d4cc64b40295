package com.flamingo.ai.docsearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.MgetResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.get.GetResult;
import co.elastic.clients.elasticsearch.core.mget.MultiGetResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.docsearch.exception.IndexStoreException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Provides index creation and mapping validation, bulk indexing, lookups by id, searches and
 * deletes. Subclasses define the document-specific schema and conversion logic. Every transport or
 * server failure is rethrown as {@link IndexStoreException}.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Returns the Elasticsearch index name.
   *
   * @return the index name
   */
  @Override
  public abstract String getIndexName();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  /**
   * Converts a document entity to an Elasticsearch document map.
   *
   * @param entity the entity to convert
   * @return the Elasticsearch document map
   */
  protected abstract Map<String, Object> convertToDocument(T entity);

  /**
   * Converts an Elasticsearch document map to a document entity.
   *
   * @param source the Elasticsearch document map, with the hit id injected as {@code id}
   * @return the document entity
   */
  protected abstract T convertFromDocument(Map<String, Object> source);

  /**
   * Extracts the document ID from the entity.
   *
   * @param entity the entity
   * @return the document ID
   */
  protected abstract String getDocumentId(T entity);

  /**
   * Returns the metric prefix for this index (e.g., "document_chunk").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (Exception e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false keeps undeclared fields out of the mapping
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches.
   *
   * <p>Elasticsearch allows adding new fields via the Put Mapping API but does not allow changing
   * the type of existing fields. Missing fields are added automatically; type mismatches cause the
   * application to fail fast so the index can be recreated manually.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      String field = entry.getKey();
      Property expected = entry.getValue();
      Property actual = actualProperties.get(field);
      if (actual != null && expected._kind() != actual._kind()) {
        String msg =
            String.format(
                "Mapping mismatch in index '%s': field '%s' expected type '%s' but found '%s'. "
                    + "Delete the index and restart the application to apply correct mappings.",
                getIndexName(), field, expected._kind(), actual._kind());
        log.error(msg);
        mismatches.add(msg);
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s). "
              + String.join("; ", mismatches));
    }

    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      if (!actualProperties.containsKey(entry.getKey())) {
        missingFields.put(entry.getKey(), entry.getValue());
      }
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        String reason =
            response.items().stream()
                .map(BulkResponseItem::error)
                .filter(error -> error != null)
                .map(error -> error.type() + ": " + error.reason())
                .findFirst()
                .orElse("unknown");
        throw new IndexStoreException(
            "index", "Bulk indexing into " + getIndexName() + " failed: " + reason);
      }
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexStoreException("index", "Failed to index documents", e);
    }
  }

  /**
   * Executes a search and returns the raw hits.
   *
   * @param operation operation name for metrics and errors
   * @param request the search request
   * @return hits in response order
   */
  @SuppressWarnings("rawtypes")
  protected List<Hit<Map>> search(String operation, SearchRequest request) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<Hit<Map>> hits = response.hits().hits();
      log.debug("[{}] index={} returned={}", operation, getIndexName(), hits.size());
      meterRegistry.counter(getMetricPrefix() + "." + operation).increment();
      return hits;
    } catch (IOException | ElasticsearchException e) {
      log.error("{} failed for {}: {}", operation, getIndexName(), e.getMessage(), e);
      throw new IndexStoreException(operation, operation + " failed", e);
    }
  }

  /**
   * Loads one document by id.
   *
   * @param id the document id
   * @return the document if it exists
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  protected Optional<T> findById(String id) {
    try {
      GetResponse<Map> response =
          elasticsearchClient.get(g -> g.index(getIndexName()).id(id), Map.class);
      if (!response.found() || response.source() == null) {
        return Optional.empty();
      }
      Map<String, Object> source = response.source();
      source.put("id", response.id());
      return Optional.of(convertFromDocument(source));
    } catch (IOException | ElasticsearchException e) {
      log.error("Get {} failed for {}: {}", id, getIndexName(), e.getMessage(), e);
      throw new IndexStoreException("get", "Failed to load document " + id, e);
    }
  }

  /**
   * Loads several documents by id in one round trip. Missing ids are skipped.
   *
   * @param ids the document ids
   * @return the documents found
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  protected List<T> findAllById(Collection<String> ids) {
    if (ids.isEmpty()) {
      return List.of();
    }
    try {
      MgetResponse<Map> response =
          elasticsearchClient.mget(
              m -> m.index(getIndexName()).ids(new ArrayList<>(ids)), Map.class);
      List<T> documents = new ArrayList<>();
      for (MultiGetResponseItem<Map> item : response.docs()) {
        if (!item.isResult()) {
          continue;
        }
        GetResult<Map> result = item.result();
        if (result.found() && result.source() != null) {
          Map<String, Object> source = result.source();
          source.put("id", result.id());
          documents.add(convertFromDocument(source));
        }
      }
      return documents;
    } catch (IOException | ElasticsearchException e) {
      log.error("Multi-get failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexStoreException("mget", "Failed to load documents", e);
    }
  }

  /**
   * Converts search hits that carry a source into entities, injecting the hit id.
   *
   * @param hits the search hits
   * @return the entities in hit order
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  protected List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata and not part of _source
        source.put("id", hit.id());
        documents.add(convertFromDocument(source));
      }
    }
    return documents;
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete documents by criteria")
  public void deleteBy(Query query) {
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(query).refresh(true));
      var response = elasticsearchClient.deleteByQuery(request);
      log.info("Deleted {} documents from {}", response.deleted(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to delete documents from {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexStoreException("delete", "Failed to delete documents", e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException | ElasticsearchException e) {
      throw new IndexStoreException("refresh", "Failed to refresh " + getIndexName(), e);
    }
  }

  @Override
  public long count() {
    try {
      return elasticsearchClient.count(c -> c.index(getIndexName())).count();
    } catch (IOException | ElasticsearchException e) {
      log.error("Count failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexStoreException("count", "Failed to count documents", e);
    }
  }
}
