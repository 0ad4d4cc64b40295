package com.flamingo.ai.docsearch.store;

import com.flamingo.ai.docsearch.domain.enums.EmbeddingSource;
import com.flamingo.ai.docsearch.elasticsearch.DocumentChunk;
import com.flamingo.ai.docsearch.service.rag.KeywordExtractor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * {@link ChunkIndexStore} held in a {@link ConcurrentHashMap}, for local runs without
 * Elasticsearch and for tests.
 *
 * <p>Similarity is exact cosine over all chunks of the same provider tier and dimension. Keyword
 * scoring sums {@code 1 + ln(tf)} over the matched terms, plus a bonus when the term is one of the
 * chunk's extracted keywords.
 */
@Service
@ConditionalOnProperty(name = "rag.index-store.type", havingValue = "memory")
@RequiredArgsConstructor
@Slf4j
public class InMemoryChunkIndexStore implements ChunkIndexStore {

  private static final double KEYWORD_BONUS = 0.5;

  private final KeywordExtractor keywordExtractor;
  private final Map<String, DocumentChunk> chunks = new ConcurrentHashMap<>();

  @Override
  public void upsertChunks(List<DocumentChunk> batch) {
    for (DocumentChunk chunk : batch) {
      chunks.put(chunk.getId(), chunk);
    }
    log.debug("Upserted {} chunks, store now holds {}", batch.size(), chunks.size());
  }

  @Override
  public List<SemanticHit> nearestNeighbors(List<Float> vector, EmbeddingSource source, int k) {
    if (vector == null || vector.isEmpty() || k <= 0) {
      return List.of();
    }
    List<SemanticHit> hits = new ArrayList<>();
    for (DocumentChunk chunk : chunks.values()) {
      List<Float> embedding = chunk.getEmbedding();
      if (chunk.getEmbeddingSource() != source
          || embedding == null
          || embedding.size() != vector.size()) {
        continue;
      }
      hits.add(new SemanticHit(chunk.getId(), cosine(vector, embedding)));
    }
    hits.sort(
        Comparator.comparingDouble(SemanticHit::similarity)
            .reversed()
            .thenComparing(SemanticHit::chunkId));
    return hits.size() > k ? List.copyOf(hits.subList(0, k)) : hits;
  }

  @Override
  public List<KeywordHit> keywordSearch(List<String> terms, int k) {
    if (terms == null || terms.isEmpty() || k <= 0) {
      return List.of();
    }
    List<KeywordHit> hits = new ArrayList<>();
    for (DocumentChunk chunk : chunks.values()) {
      Map<String, Integer> frequencies = new HashMap<>();
      for (String token : keywordExtractor.terms(chunk.getContent())) {
        frequencies.merge(token, 1, Integer::sum);
      }
      Set<String> chunkKeywords =
          chunk.getKeywords() == null ? Set.of() : new HashSet<>(chunk.getKeywords());

      double score = 0;
      List<String> matched = new ArrayList<>();
      for (String term : terms) {
        int tf = frequencies.getOrDefault(term, 0);
        boolean keyword = chunkKeywords.contains(term);
        if (tf == 0 && !keyword) {
          continue;
        }
        matched.add(term);
        score += (tf > 0 ? 1 + Math.log(tf) : 0) + (keyword ? KEYWORD_BONUS : 0);
      }
      if (!matched.isEmpty()) {
        hits.add(new KeywordHit(chunk.getId(), score, List.copyOf(matched)));
      }
    }
    hits.sort(
        Comparator.comparingDouble(KeywordHit::matchScore)
            .reversed()
            .thenComparing(KeywordHit::chunkId));
    return hits.size() > k ? List.copyOf(hits.subList(0, k)) : hits;
  }

  @Override
  public Optional<DocumentChunk> getChunk(String chunkId) {
    return Optional.ofNullable(chunks.get(chunkId));
  }

  @Override
  public List<DocumentChunk> getChunks(Collection<String> chunkIds) {
    return chunkIds.stream().map(chunks::get).filter(Objects::nonNull).toList();
  }

  @Override
  public List<DocumentChunk> getChunksByDocument(String documentId) {
    return chunks.values().stream()
        .filter(chunk -> documentId.equals(chunk.getDocumentId()))
        .sorted(Comparator.comparingInt(DocumentChunk::getChunkIndex))
        .toList();
  }

  @Override
  public void deleteDocument(String documentId) {
    int before = chunks.size();
    chunks.values().removeIf(chunk -> documentId.equals(chunk.getDocumentId()));
    log.debug("Deleted {} chunks of document {}", before - chunks.size(), documentId);
  }

  @Override
  public long countChunks() {
    return chunks.size();
  }

  private static double cosine(List<Float> a, List<Float> b) {
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0 || normB == 0) {
      return 0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
