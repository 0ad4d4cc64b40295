package com.flamingo.ai.docsearch.domain.enums;

/** Ranking strategy requested by a search caller. */
public enum SearchMode {
  /** Vector similarity only. */
  SEMANTIC,

  /** Lexical term matching only. */
  KEYWORD,

  /** Weighted fusion of both legs. */
  HYBRID
}
