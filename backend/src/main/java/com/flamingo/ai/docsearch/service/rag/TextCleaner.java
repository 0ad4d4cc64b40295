package com.flamingo.ai.docsearch.service.rag;

import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Normalizes raw document text before fingerprinting and chunking.
 *
 * <p>Line endings become {@code \n}, runs of spaces and tabs collapse to one space, three or more
 * newlines collapse to a paragraph break. Markdown documents additionally lose heading markers,
 * emphasis, inline code ticks and link targets.
 */
@Component
public class TextCleaner {

  private static final Pattern CARRIAGE_RETURN = Pattern.compile("\\r\\n?");
  private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f]+");
  private static final Pattern TRAILING_SPACE = Pattern.compile(" +\\n");
  private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

  private static final Pattern MD_HEADING = Pattern.compile("(?m)^#{1,6}[ \\t]+");
  private static final Pattern MD_BOLD = Pattern.compile("\\*\\*(.+?)\\*\\*|__(.+?)__");
  private static final Pattern MD_ITALIC =
      Pattern.compile("(?<![*\\w])[*_]([^*_\\n]+)[*_](?![*\\w])");
  private static final Pattern MD_INLINE_CODE = Pattern.compile("`([^`]*)`");
  private static final Pattern MD_LINK = Pattern.compile("!?\\[([^\\]]*)]\\([^)]*\\)");

  /**
   * Cleans text for the given format tag.
   *
   * @param text raw extracted text
   * @param format format tag such as {@code txt} or {@code md}; may be null
   * @return cleaned text, possibly empty
   */
  public String clean(String text, String format) {
    if (text == null) {
      return "";
    }
    String cleaned = CARRIAGE_RETURN.matcher(text).replaceAll("\n");
    if (isMarkdown(format)) {
      cleaned = stripMarkdown(cleaned);
    }
    cleaned = HORIZONTAL_SPACE.matcher(cleaned).replaceAll(" ");
    cleaned = TRAILING_SPACE.matcher(cleaned).replaceAll("\n");
    cleaned = EXCESS_NEWLINES.matcher(cleaned).replaceAll("\n\n");
    return cleaned.strip();
  }

  private boolean isMarkdown(String format) {
    if (format == null) {
      return false;
    }
    String normalized = format.toLowerCase(Locale.ROOT);
    return normalized.equals("md") || normalized.equals("markdown");
  }

  private String stripMarkdown(String text) {
    String stripped = MD_HEADING.matcher(text).replaceAll("");
    stripped = MD_LINK.matcher(stripped).replaceAll("$1");
    stripped = MD_BOLD.matcher(stripped).replaceAll("$1$2");
    stripped = MD_ITALIC.matcher(stripped).replaceAll("$1");
    return MD_INLINE_CODE.matcher(stripped).replaceAll("$1");
  }
}
