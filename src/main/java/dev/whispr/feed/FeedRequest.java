package dev.whispr.feed;

/**
 * Pagination of one feed request.
 *
 * @param skip number of assembled items to skip (>= 0)
 * @param limit target feed size and page size (1 to {@value #MAX_LIMIT})
 */
public record FeedRequest(int skip, int limit) {

  public static final int MAX_LIMIT = 100;

  /** Compact constructor validating the bounds. */
  public FeedRequest {
    if (skip < 0) {
      throw new IllegalArgumentException("skip must be at least 0");
    }
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
  }
}
