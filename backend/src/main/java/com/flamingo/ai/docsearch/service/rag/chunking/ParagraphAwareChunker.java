package com.flamingo.ai.docsearch.service.rag.chunking;

import com.flamingo.ai.docsearch.config.RagConfig;
import com.flamingo.ai.docsearch.service.rag.model.RawDocumentChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that packs whole paragraphs into chunks of at most the configured size.
 *
 * <p>Boundaries are chosen at paragraph breaks first, then at sentence breaks inside a paragraph
 * that is too large, and only as a last resort by characters (for a single sentence longer than the
 * hard limit). A sentence that exceeds the chunk size but not the hard limit is kept whole in an
 * oversized chunk.
 *
 * <p>The size bounds the chunk body. Every chunk after the first is then prefixed with the
 * trailing {@code overlap} characters of the previous chunk, snapped forward to a word boundary,
 * so its content may reach {@code size + overlap + 1} characters.
 */
@Service
@Slf4j
public class ParagraphAwareChunker implements DocumentChunker {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
  private static final String PARAGRAPH_SEPARATOR = "\n\n";
  private static final String SENTENCE_SEPARATOR = " ";

  @Override
  public List<RawDocumentChunk> chunk(String text, RagConfig.Chunking settings) {
    return chunk(text, settings.getSize(), settings.getOverlap(), settings.getHardLimit());
  }

  /**
   * Chunks text with a hard limit of four times the chunk size.
   *
   * @param text the text to split
   * @param size target chunk size in characters
   * @param overlap characters repeated from the previous chunk
   * @return ordered chunks
   */
  public List<RawDocumentChunk> chunk(String text, int size, int overlap) {
    return chunk(text, size, overlap, size * 4);
  }

  /**
   * Chunks text.
   *
   * @param text the text to split
   * @param size target chunk size in characters
   * @param overlap characters repeated from the previous chunk
   * @param hardLimit sentences longer than this are cut by characters
   * @return ordered chunks
   */
  public List<RawDocumentChunk> chunk(String text, int size, int overlap, int hardLimit) {
    if (size <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive, got " + size);
    }
    if (overlap < 0 || overlap >= size) {
      throw new IllegalArgumentException(
          "Chunk overlap must be in [0, " + size + "), got " + overlap);
    }
    if (text == null || text.isBlank()) {
      return List.of();
    }

    Packer packer = new Packer(size, Math.max(size, hardLimit));
    for (String rawParagraph : PARAGRAPH_BREAK.split(text.strip())) {
      String paragraph = rawParagraph.strip();
      if (!paragraph.isEmpty()) {
        packer.addParagraph(paragraph);
      }
    }
    List<String> bodies = packer.finish();

    List<RawDocumentChunk> chunks = new ArrayList<>(bodies.size());
    String previous = null;
    for (int i = 0; i < bodies.size(); i++) {
      String body = bodies.get(i);
      String prefix = previous == null ? "" : overlapTail(previous, overlap);
      String content = prefix.isEmpty() ? body : prefix + SENTENCE_SEPARATOR + body;
      int overlapLength = prefix.isEmpty() ? 0 : prefix.length() + SENTENCE_SEPARATOR.length();
      chunks.add(new RawDocumentChunk(content, i, overlapLength));
      previous = content;
    }

    log.debug(
        "ParagraphAwareChunker produced {} chunks from {} chars (size={}, overlap={})",
        chunks.size(),
        text.length(),
        size,
        overlap);
    return chunks;
  }

  /**
   * Returns roughly the last {@code overlap} characters of {@code text}, moved forward to the next
   * word start so no word is split. Falls back to a plain character cut for text without spaces.
   */
  private String overlapTail(String text, int overlap) {
    if (overlap == 0) {
      return "";
    }
    if (text.length() <= overlap) {
      return text.strip();
    }
    int start = text.length() - overlap;
    if (!Character.isWhitespace(text.charAt(start - 1))) {
      int next = start;
      while (next < text.length() && !Character.isWhitespace(text.charAt(next))) {
        next++;
      }
      if (next < text.length()) {
        start = next;
      }
    }
    return text.substring(start).strip();
  }

  /** Greedy packer for chunk bodies (chunk text without the overlap prefix). */
  private static final class Packer {

    private final int size;
    private final int hardLimit;
    private final List<String> bodies = new ArrayList<>();
    private final StringBuilder current = new StringBuilder();

    Packer(int size, int hardLimit) {
      this.size = size;
      this.hardLimit = hardLimit;
    }

    void addParagraph(String paragraph) {
      if (fits(paragraph, PARAGRAPH_SEPARATOR)) {
        append(paragraph, PARAGRAPH_SEPARATOR);
        return;
      }
      flush();
      if (paragraph.length() <= size) {
        current.append(paragraph);
        return;
      }
      String[] sentences = SENTENCE_BREAK.split(paragraph);
      for (String sentence : sentences) {
        addSentence(sentence.strip());
      }
    }

    private void addSentence(String sentence) {
      if (sentence.isEmpty()) {
        return;
      }
      if (fits(sentence, SENTENCE_SEPARATOR)) {
        append(sentence, SENTENCE_SEPARATOR);
        return;
      }
      flush();
      if (sentence.length() <= size) {
        current.append(sentence);
      } else if (sentence.length() <= hardLimit) {
        bodies.add(sentence);
      } else {
        cutByCharacters(sentence);
      }
    }

    private void cutByCharacters(String sentence) {
      String remaining = sentence;
      while (remaining.length() > size) {
        int cut = remaining.lastIndexOf(' ', size);
        if (cut <= 0) {
          cut = size;
        }
        bodies.add(remaining.substring(0, cut).strip());
        remaining = remaining.substring(cut).strip();
      }
      if (!remaining.isEmpty()) {
        current.append(remaining);
      }
    }

    private boolean fits(String piece, String separator) {
      if (current.length() == 0) {
        return false;
      }
      return current.length() + separator.length() + piece.length() <= size;
    }

    private void append(String piece, String separator) {
      current.append(separator).append(piece);
    }

    private void flush() {
      if (current.length() > 0) {
        bodies.add(current.toString());
        current.setLength(0);
      }
    }

    List<String> finish() {
      flush();
      return bodies;
    }
  }
}
