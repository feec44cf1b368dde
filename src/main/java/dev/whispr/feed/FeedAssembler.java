package dev.whispr.feed;

import dev.whispr.review.Review;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Component;

/**
 * Turns the sampled candidates of all phases into one feed page: dedupe by review id (first
 * occurrence wins, so earlier phases take precedence), shuffle the whole list once, then slice
 * {@code [skip, skip + limit)}. A list shorter than the page is returned as is.
 */
@Component
public class FeedAssembler {

  private final RandomGenerator random;

  public FeedAssembler(RandomGenerator random) {
    this.random = random;
  }

  /**
   * Assembles a feed page.
   *
   * @param survivors sampled candidates in phase order
   * @param request the page to return
   * @return at most {@code request.limit()} distinct reviews in random order
   */
  public List<Review> assemble(List<FeedCandidate> survivors, FeedRequest request) {
    Map<UUID, Review> distinct = new LinkedHashMap<>();
    for (FeedCandidate candidate : survivors) {
      distinct.putIfAbsent(candidate.reviewId(), candidate.review());
    }
    List<Review> feed = new ArrayList<>(distinct.values());
    shuffle(feed);

    int from = Math.min(request.skip(), feed.size());
    int to = Math.min(feed.size(), from + request.limit());
    return List.copyOf(feed.subList(from, to));
  }

  /** Fisher-Yates shuffle driven by the injected generator. */
  private void shuffle(List<Review> reviews) {
    for (int i = reviews.size() - 1; i > 0; i--) {
      int j = random.nextInt(i + 1);
      Review swap = reviews.get(i);
      reviews.set(i, reviews.get(j));
      reviews.set(j, swap);
    }
  }
}
