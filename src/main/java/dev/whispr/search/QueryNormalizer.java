package dev.whispr.search;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns free text into a canonical {@link TokenSequence}: lowercase, trimmed, stripped of
 * everything but letters, digits and whitespace, split on whitespace runs. Letters, digits and
 * whitespace are matched by their Unicode properties, so no-break and ideographic spaces separate
 * tokens too.
 */
public final class QueryNormalizer {

  private static final Pattern NON_ALPHANUMERIC =
      Pattern.compile("[^\\p{IsAlphabetic}\\p{IsDigit}\\s]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private QueryNormalizer() {
    // utility class
  }

  /**
   * Normalizes raw query text. Never fails: blank or punctuation-only input yields an empty
   * sequence, which the search path rejects and the feed path never asks for.
   *
   * @param raw the raw query text, may be {@code null}
   * @return the token sequence, possibly empty
   */
  public static TokenSequence normalize(String raw) {
    if (raw == null) {
      return new TokenSequence(List.of());
    }
    String cleaned = NON_ALPHANUMERIC.matcher(raw.toLowerCase(Locale.ROOT).strip()).replaceAll("");
    String collapsed = WHITESPACE.matcher(cleaned).replaceAll(" ").strip();
    if (collapsed.isEmpty()) {
      return new TokenSequence(List.of());
    }
    return new TokenSequence(Arrays.asList(collapsed.split(" ")));
  }
}
