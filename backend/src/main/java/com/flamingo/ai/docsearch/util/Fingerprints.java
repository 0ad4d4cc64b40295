package com.flamingo.ai.docsearch.util;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;

/** Content fingerprints used as document ids, chunk fingerprints and cache keys. */
public final class Fingerprints {

  private Fingerprints() {}

  /**
   * Returns the lower-case hex SHA-256 of the UTF-8 bytes of {@code text}.
   *
   * @param text the text to hash
   * @return 64 hex characters
   */
  public static String sha256(String text) {
    return Hashing.sha256().hashString(text, StandardCharsets.UTF_8).toString();
  }
}
