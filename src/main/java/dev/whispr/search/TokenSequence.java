package dev.whispr.search;

import java.util.List;

/**
 * Ordered, lowercase, alphanumeric tokens of a normalized query. An empty sequence is a valid
 * value but can never be searched for.
 *
 * @param tokens the tokens in query order
 */
public record TokenSequence(List<String> tokens) {

  public TokenSequence {
    tokens = List.copyOf(tokens);
  }

  public boolean isEmpty() {
    return tokens.isEmpty();
  }

  public int size() {
    return tokens.size();
  }

  /** The tokens joined by single spaces, used for exact-phrase matching. */
  public String phrase() {
    return String.join(" ", tokens);
  }
}
