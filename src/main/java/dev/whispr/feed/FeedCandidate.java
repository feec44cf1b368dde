package dev.whispr.feed;

import dev.whispr.review.Review;
import java.util.UUID;

/**
 * A review proposed for one feed request, with the phase that produced it and the probability of
 * its Bernoulli trial. Lives for a single request only.
 *
 * @param review the candidate review, relations fetched
 * @param sourcePhase the phase that produced the candidate
 * @param inclusionProbability probability in (0, 1] that the candidate survives sampling
 */
public record FeedCandidate(Review review, FeedPhase sourcePhase, double inclusionProbability) {

  public UUID reviewId() {
    return review.getId();
  }
}
