package com.flamingo.ai.docsearch.store;

/**
 * A nearest-neighbour match.
 *
 * @param chunkId id of the matched chunk
 * @param similarity cosine similarity in [-1, 1]
 */
public record SemanticHit(String chunkId, double similarity) {}
