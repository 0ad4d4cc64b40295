package com.flamingo.ai.docsearch.service.rag.model;

import java.util.List;

/**
 * One ranked search hit.
 *
 * @param chunkId chunk id
 * @param documentId owning document
 * @param fileName owning document's file name
 * @param chunkIndex position of the chunk in its document
 * @param content full chunk text
 * @param semanticScore cosine similarity from the vector leg, 0 when the chunk was not found there
 * @param keywordScore raw match score from the keyword leg, 0 when not found there
 * @param fusedScore weighted sum of both normalized scores, in [0, 1]
 * @param relevanceScore fused score times the ranking boost; results are ordered by it
 * @param matchedKeywords query terms found in the chunk
 * @param contextWindow excerpt around the densest run of query terms
 * @param degraded whether the vector leg used the fallback tier or was unavailable
 */
public record ScoredResult(
    String chunkId,
    String documentId,
    String fileName,
    int chunkIndex,
    String content,
    double semanticScore,
    double keywordScore,
    double fusedScore,
    double relevanceScore,
    List<String> matchedKeywords,
    String contextWindow,
    boolean degraded) {

  public ScoredResult {
    matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
  }
}
