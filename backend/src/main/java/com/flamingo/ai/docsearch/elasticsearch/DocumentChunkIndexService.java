package com.flamingo.ai.docsearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.docsearch.domain.enums.EmbeddingSource;
import com.flamingo.ai.docsearch.exception.IndexStoreException;
import com.flamingo.ai.docsearch.service.rag.KeywordExtractor;
import com.flamingo.ai.docsearch.store.ChunkIndexStore;
import com.flamingo.ai.docsearch.store.KeywordHit;
import com.flamingo.ai.docsearch.store.SemanticHit;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed {@link ChunkIndexStore}.
 *
 * <p>Vectors are stored in one {@code dense_vector} field per provider tier ({@code
 * primaryEmbedding}, {@code fallbackEmbedding}) because the tiers have different dimensions and
 * their vectors must never be compared. Keyword search runs a BM25 {@code match} on the content
 * combined with a {@code terms} query on the extracted keywords.
 */
@Service
@ConditionalOnProperty(
    name = "rag.index-store.type",
    havingValue = "elasticsearch",
    matchIfMissing = true)
@Slf4j
public class DocumentChunkIndexService extends AbstractElasticsearchIndexService<DocumentChunk>
    implements ChunkIndexStore {

  static final String PRIMARY_EMBEDDING_FIELD = "primaryEmbedding";
  static final String FALLBACK_EMBEDDING_FIELD = "fallbackEmbedding";
  private static final int MAX_CHUNKS_PER_DOCUMENT = 10_000;

  private final KeywordExtractor keywordExtractor;

  @Value("${app.elasticsearch.index-name:docsearch-chunks}")
  private String indexName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int primaryDimensions;

  @Value("${app.elasticsearch.fallback-dimensions:384}")
  private int fallbackDimensions;

  @Value("${app.elasticsearch.text-analyzer:standard}")
  private String textAnalyzer;

  @Value("${app.elasticsearch.text-search-analyzer:standard}")
  private String textSearchAnalyzer;

  @Autowired
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      KeywordExtractor keywordExtractor) {
    super(elasticsearchClient, meterRegistry);
    this.keywordExtractor = keywordExtractor;
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      KeywordExtractor keywordExtractor,
      String indexName,
      int primaryDimensions,
      int fallbackDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.keywordExtractor = keywordExtractor;
    this.indexName = indexName;
    this.primaryDimensions = primaryDimensions;
    this.fallbackDimensions = fallbackDimensions;
    this.textAnalyzer = "standard";
    this.textSearchAnalyzer = "standard";
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    log.info(
        "Defining index '{}' with text analyzer: {}, search analyzer: {}",
        indexName,
        textAnalyzer,
        textSearchAnalyzer);

    Map<String, Property> properties = new HashMap<>();
    // documentId must be keyword type for exact matching
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("fileName", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "content",
        Property.of(
            p ->
                p.text(
                    TextProperty.of(
                        t -> t.analyzer(textAnalyzer).searchAnalyzer(textSearchAnalyzer)))));
    properties.put("fingerprint", Property.of(p -> p.keyword(k -> k)));
    properties.put("keywords", Property.of(p -> p.keyword(k -> k)));
    properties.put("embeddingSource", Property.of(p -> p.keyword(k -> k)));
    properties.put("embeddingDimension", Property.of(p -> p.integer(i -> i)));
    properties.put("wordCount", Property.of(p -> p.integer(i -> i)));
    properties.put("charCount", Property.of(p -> p.integer(i -> i)));
    properties.put("createdAt", Property.of(p -> p.date(d -> d)));
    properties.put(PRIMARY_EMBEDDING_FIELD, denseVector(primaryDimensions));
    properties.put(FALLBACK_EMBEDDING_FIELD, denseVector(fallbackDimensions));
    return properties;
  }

  private static Property denseVector(int dimensions) {
    return Property.of(
        p ->
            p.denseVector(
                DenseVectorProperty.of(
                    d -> d.dims(dimensions).index(true).similarity(DenseVectorSimilarity.Cosine))));
  }

  @Override
  protected Map<String, Object> convertToDocument(DocumentChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("documentId", chunk.getDocumentId());
    document.put("fileName", chunk.getFileName());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("content", chunk.getContent());
    document.put("fingerprint", chunk.getFingerprint());
    document.put("keywords", chunk.getKeywords());
    document.put("embeddingDimension", chunk.getEmbeddingDimension());
    document.put("wordCount", chunk.getWordCount());
    document.put("charCount", chunk.getCharCount());
    if (chunk.getCreatedAt() != null) {
      document.put("createdAt", chunk.getCreatedAt().toString());
    }
    if (chunk.getEmbeddingSource() != null && chunk.getEmbedding() != null) {
      document.put("embeddingSource", chunk.getEmbeddingSource().name());
      document.put(embeddingField(chunk.getEmbeddingSource()), chunk.getEmbedding());
    }
    return document;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected DocumentChunk convertFromDocument(Map<String, Object> source) {
    DocumentChunk.DocumentChunkBuilder builder =
        DocumentChunk.builder()
            .id((String) source.get("id"))
            .documentId((String) source.get("documentId"))
            .fileName((String) source.get("fileName"))
            .chunkIndex(intValue(source.get("chunkIndex")))
            .content((String) source.get("content"))
            .fingerprint((String) source.get("fingerprint"))
            .embeddingDimension(intValue(source.get("embeddingDimension")))
            .wordCount(intValue(source.get("wordCount")))
            .charCount(intValue(source.get("charCount")));

    if (source.get("keywords") instanceof List<?> keywords) {
      builder.keywords((List<String>) keywords);
    }
    if (source.get("createdAt") instanceof String createdAt) {
      builder.createdAt(Instant.parse(createdAt));
    }
    if (source.get("embeddingSource") instanceof String embeddingSource) {
      EmbeddingSource tier = EmbeddingSource.valueOf(embeddingSource);
      builder.embeddingSource(tier);
      if (source.get(embeddingField(tier)) instanceof List<?> vector) {
        builder.embedding(toFloatList(vector));
      }
    }
    return builder.build();
  }

  @Override
  protected String getDocumentId(DocumentChunk entity) {
    return entity.getId();
  }

  @Override
  protected String getMetricPrefix() {
    return "document_chunk";
  }

  @Override
  @Timed(value = "index.upsert", description = "Time to upsert chunks")
  public void upsertChunks(List<DocumentChunk> chunks) {
    indexDocuments(chunks);
    refresh();
  }

  @Override
  @Timed(value = "index.nearest_neighbors", description = "Time for vector search")
  @SuppressWarnings("rawtypes")
  public List<SemanticHit> nearestNeighbors(List<Float> vector, EmbeddingSource source, int k) {
    if (vector == null || vector.isEmpty() || k <= 0) {
      return List.of();
    }
    int expected = source == EmbeddingSource.PRIMARY ? primaryDimensions : fallbackDimensions;
    if (vector.size() != expected) {
      throw new IndexStoreException(
          "nearest_neighbors",
          "Query vector has " + vector.size() + " dimensions, index expects " + expected);
    }
    String field = embeddingField(source);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        knn ->
                            knn.field(field)
                                .queryVector(vector)
                                .k(k)
                                .numCandidates(Math.max(k * 2, 50)))
                    .source(src -> src.fetch(false))
                    .size(k));

    List<SemanticHit> hits = new ArrayList<>();
    for (Hit<Map> hit : search("vector_search", request)) {
      if (hit.score() != null) {
        // cosine knn scores are (1 + cos) / 2
        hits.add(new SemanticHit(hit.id(), 2 * hit.score() - 1));
      }
    }
    return hits;
  }

  @Override
  @Timed(value = "index.keyword_search", description = "Time for keyword search")
  @SuppressWarnings("rawtypes")
  public List<KeywordHit> keywordSearch(List<String> terms, int k) {
    if (terms == null || terms.isEmpty() || k <= 0) {
      return List.of();
    }
    List<FieldValue> keywordValues = terms.stream().map(FieldValue::of).toList();
    String matchText = String.join(" ", terms);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(
                        q ->
                            q.bool(
                                b ->
                                    b.should(
                                            sh ->
                                                sh.match(
                                                    m -> m.field("content").query(matchText)))
                                        .should(
                                            sh ->
                                                sh.terms(
                                                    t ->
                                                        t.field("keywords")
                                                            .terms(tv -> tv.value(keywordValues))))
                                        .minimumShouldMatch("1")))
                    .source(src -> src.filter(f -> f.includes("content", "keywords")))
                    .size(k));

    List<KeywordHit> hits = new ArrayList<>();
    for (Hit<Map> hit : search("keyword_search", request)) {
      double score = hit.score() != null ? hit.score() : 0.0;
      hits.add(new KeywordHit(hit.id(), score, matchedTerms(terms, hit.source())));
    }
    return hits;
  }

  private List<String> matchedTerms(List<String> terms, Map<?, ?> source) {
    if (source == null) {
      return List.of();
    }
    Set<String> present = new HashSet<>();
    if (source.get("content") instanceof String content) {
      present.addAll(keywordExtractor.terms(content));
    }
    if (source.get("keywords") instanceof List<?> keywords) {
      keywords.forEach(keyword -> present.add(String.valueOf(keyword)));
    }
    return terms.stream().filter(present::contains).toList();
  }

  @Override
  public Optional<DocumentChunk> getChunk(String chunkId) {
    return findById(chunkId);
  }

  @Override
  public List<DocumentChunk> getChunks(Collection<String> chunkIds) {
    return findAllById(chunkIds);
  }

  @Override
  public List<DocumentChunk> getChunksByDocument(String documentId) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(q -> q.term(t -> t.field("documentId").value(documentId)))
                    .sort(so -> so.field(f -> f.field("chunkIndex").order(SortOrder.Asc)))
                    .size(MAX_CHUNKS_PER_DOCUMENT));
    return mapHitsToDocuments(search("document_chunks", request));
  }

  @Override
  public void deleteDocument(String documentId) {
    deleteBy(Query.of(q -> q.term(t -> t.field("documentId").value(documentId))));
  }

  @Override
  public long countChunks() {
    return count();
  }

  private static String embeddingField(EmbeddingSource source) {
    return source == EmbeddingSource.PRIMARY ? PRIMARY_EMBEDDING_FIELD : FALLBACK_EMBEDDING_FIELD;
  }

  private static int intValue(Object value) {
    return value instanceof Number number ? number.intValue() : 0;
  }

  private static List<Float> toFloatList(List<?> values) {
    List<Float> result = new ArrayList<>(values.size());
    for (Object value : values) {
      result.add(((Number) value).floatValue());
    }
    return result;
  }
}
