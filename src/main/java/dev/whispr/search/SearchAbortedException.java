package dev.whispr.search;

/**
 * Thrown when a search fan-out does not finish: it ran past its deadline or the calling thread was
 * interrupted. All adapter tasks of the search are cancelled; no partial result exists.
 */
public class SearchAbortedException extends RuntimeException {

  public SearchAbortedException(String message) {
    super(message);
  }

  public SearchAbortedException(String message, Throwable cause) {
    super(message, cause);
  }
}
