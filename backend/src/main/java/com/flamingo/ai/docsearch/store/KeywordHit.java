package com.flamingo.ai.docsearch.store;

import java.util.List;

/**
 * A lexical match.
 *
 * @param chunkId id of the matched chunk
 * @param matchScore non-negative relevance score, comparable only within one search
 * @param matchedTerms query terms found in the chunk
 */
public record KeywordHit(String chunkId, double matchScore, List<String> matchedTerms) {}
