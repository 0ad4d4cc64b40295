package com.flamingo.ai.docsearch.service.rag;

import com.flamingo.ai.docsearch.config.RagConfig;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts a bounded set of normalized keywords from chunk text and the search terms from a query.
 *
 * <p>Text is lower-cased with {@link Locale#ROOT} before tokenization, so extraction is
 * insensitive to case. Punctuation only separates tokens, so it has no effect on the result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KeywordExtractor {

  private static final int MIN_TERM_LENGTH = 3;
  private static final int LONG_TERM_LENGTH = 6;
  private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}']+");
  private static final Pattern EDGE_APOSTROPHES = Pattern.compile("^'+|'+$");
  private static final Pattern DIGITS = Pattern.compile("\\p{N}+");

  // Common English stop words
  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "or", "that", "the", "to", "was", "were", "will", "with", "this",
          "but", "they", "have", "had", "what", "when", "where", "who", "which", "why", "how",
          "all", "each", "every", "both", "few", "more", "most", "other", "some", "such", "no",
          "nor", "not", "only", "own", "same", "so", "than", "too", "very", "just", "can", "should",
          "now", "been", "being", "do", "does", "did", "doing", "would", "could", "might", "must",
          "shall", "may", "about", "above", "after", "again", "against", "before", "below",
          "between", "down", "during", "into", "over", "through", "under", "until", "up", "while",
          "am", "i", "me", "my", "we", "our", "you", "your", "him", "her", "them", "their", "if",
          "then", "also", "here", "there", "these", "those", "else", "any", "many", "much", "even",
          "she", "his", "hers", "us", "out", "off", "once", "further", "because", "ours",
          "yours", "theirs", "itself", "myself", "yourself");

  private final RagConfig ragConfig;

  /**
   * Extracts keywords bounded by {@code rag.keywords.max-per-chunk}.
   *
   * @param text the chunk text
   * @return keywords ordered by descending weight
   */
  public Set<String> extract(String text) {
    return extract(text, ragConfig.getKeywords().getMaxPerChunk());
  }

  /**
   * Extracts at most {@code max} keywords, weighted by log term frequency with a bonus for longer
   * terms. Configured domain terms get {@code rag.keywords.boosted-term-bonus} extra occurrences.
   * Ties are broken alphabetically.
   *
   * @param text the chunk text
   * @param max maximum number of keywords
   * @return keywords ordered by descending weight
   */
  public Set<String> extract(String text, int max) {
    if (text == null || text.isBlank() || max <= 0) {
      return Set.of();
    }

    Map<String, Integer> frequencies = new HashMap<>();
    for (String term : terms(text)) {
      frequencies.merge(term, 1, Integer::sum);
    }
    RagConfig.Keywords settings = ragConfig.getKeywords();
    int bonus = settings.getBoostedTermBonus();
    for (String boosted : settings.getBoostedTerms()) {
      String term = boosted.toLowerCase(Locale.ROOT);
      frequencies.computeIfPresent(term, (key, count) -> count + bonus);
    }

    List<Map.Entry<String, Double>> scored = new ArrayList<>(frequencies.size());
    for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
      String term = entry.getKey();
      double tfScore = 1 + Math.log(entry.getValue());
      double lengthBonus = term.length() >= LONG_TERM_LENGTH ? 1.2 : 1.0;
      scored.add(Map.entry(term, tfScore * lengthBonus));
    }
    scored.sort(
        Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()));

    Set<String> keywords = new LinkedHashSet<>();
    for (int i = 0; i < scored.size() && keywords.size() < max; i++) {
      keywords.add(scored.get(i).getKey());
    }
    return keywords;
  }

  /**
   * Returns the distinct search terms of a query in order of first appearance, with the same
   * normalization as {@link #extract(String)} but unbounded.
   *
   * @param query the raw query
   * @return query terms, possibly empty when the query is all stop words
   */
  public List<String> queryTerms(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    return List.copyOf(new LinkedHashSet<>(terms(query)));
  }

  /**
   * Normalized tokens of {@code text} after stop-word, length and number filtering, in order and
   * with repeats.
   *
   * @param text any text
   * @return the filtered tokens
   */
  public List<String> terms(String text) {
    List<String> terms = new ArrayList<>();
    for (String raw : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
      String token = EDGE_APOSTROPHES.matcher(raw).replaceAll("");
      if (token.length() < MIN_TERM_LENGTH
          || STOP_WORDS.contains(token)
          || DIGITS.matcher(token).matches()) {
        continue;
      }
      terms.add(token);
    }
    return terms;
  }
}
