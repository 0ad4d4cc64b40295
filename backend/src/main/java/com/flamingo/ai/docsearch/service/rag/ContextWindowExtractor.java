package com.flamingo.ai.docsearch.service.rag;

import java.util.Collection;
import java.util.Locale;

/** Picks the excerpt of a chunk that contains the most query terms. */
public final class ContextWindowExtractor {

  static final int STEP = 50;
  static final String ELLIPSIS = "...";

  private ContextWindowExtractor() {}

  /**
   * Slides a window of {@code windowSize} characters over the content in steps of {@value #STEP}
   * and returns the first window with the highest number of distinct query terms. Ellipses mark
   * truncated ends.
   *
   * @param content chunk text
   * @param queryTerms lower-case query terms
   * @param windowSize excerpt length in characters
   * @return the excerpt, or the whole content when it fits
   */
  public static String extract(String content, Collection<String> queryTerms, int windowSize) {
    if (content == null || content.isEmpty()) {
      return "";
    }
    if (windowSize <= 0 || content.length() <= windowSize) {
      return content.strip();
    }

    String lower = content.toLowerCase(Locale.ROOT);
    int bestStart = 0;
    int bestMatches = 0;
    for (int start = 0; start + windowSize <= content.length(); start += STEP) {
      String window = lower.substring(start, start + windowSize);
      int matches = 0;
      for (String term : queryTerms) {
        if (window.contains(term)) {
          matches++;
        }
      }
      if (matches > bestMatches) {
        bestMatches = matches;
        bestStart = start;
      }
    }

    StringBuilder excerpt = new StringBuilder();
    if (bestStart > 0) {
      excerpt.append(ELLIPSIS);
    }
    excerpt.append(content, bestStart, bestStart + windowSize);
    if (bestStart + windowSize < content.length()) {
      excerpt.append(ELLIPSIS);
    }
    return excerpt.toString().strip();
  }
}
