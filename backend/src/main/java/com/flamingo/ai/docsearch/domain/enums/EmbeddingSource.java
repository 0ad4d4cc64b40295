package com.flamingo.ai.docsearch.domain.enums;

/**
 * Which provider tier produced a vector. Vectors from different tiers live in different spaces
 * and are never compared with each other.
 */
public enum EmbeddingSource {
  PRIMARY,
  FALLBACK
}
