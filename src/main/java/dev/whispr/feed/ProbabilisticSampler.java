package dev.whispr.feed;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Component;

/**
 * Recency-weighted soft filter over feed candidates. Each candidate gets one independent
 * Bernoulli trial; two equally old candidates of the same phase have equal but independent odds,
 * so identical requests legitimately return different feeds.
 *
 * <p>Inclusion probability by phase, with {@code daysOld} the whole days since creation (never
 * negative):
 *
 * <ul>
 *   <li>social: {@value #SOCIAL_PROBABILITY}
 *   <li>topical: {@code max(0.1, 0.5 - 0.05 * daysOld)}
 *   <li>exploratory: {@code max(0.1, 0.3 - 0.02 * daysOld)}
 * </ul>
 */
@Component
public class ProbabilisticSampler {

  static final double SOCIAL_PROBABILITY = 0.8;
  static final double TOPICAL_BASE = 0.5;
  static final double TOPICAL_DECAY_PER_DAY = 0.05;
  static final double EXPLORATORY_BASE = 0.3;
  static final double EXPLORATORY_DECAY_PER_DAY = 0.02;
  static final double MIN_PROBABILITY = 0.1;

  private final RandomGenerator random;
  private final Clock clock;

  public ProbabilisticSampler(RandomGenerator random, Clock clock) {
    this.random = random;
    this.clock = clock;
  }

  /**
   * Inclusion probability of a review created at {@code createdAt} in the given phase.
   *
   * @return a probability in [0.1, 0.8]
   */
  public double probability(FeedPhase phase, Instant createdAt) {
    long daysOld = Math.max(0L, Duration.between(createdAt, clock.instant()).toDays());
    return switch (phase) {
      case SOCIAL -> SOCIAL_PROBABILITY;
      case TOPICAL -> Math.max(MIN_PROBABILITY, TOPICAL_BASE - TOPICAL_DECAY_PER_DAY * daysOld);
      case EXPLORATORY ->
          Math.max(MIN_PROBABILITY, EXPLORATORY_BASE - EXPLORATORY_DECAY_PER_DAY * daysOld);
    };
  }

  /**
   * Runs one trial per candidate in order and keeps the survivors.
   *
   * @param candidates the candidates of one phase
   * @param capacity trials stop once this many candidates survived
   * @return the surviving candidates, in input order
   */
  public List<FeedCandidate> sample(List<FeedCandidate> candidates, int capacity) {
    List<FeedCandidate> survivors = new ArrayList<>();
    for (FeedCandidate candidate : candidates) {
      if (survivors.size() >= capacity) {
        break;
      }
      if (random.nextDouble() < candidate.inclusionProbability()) {
        survivors.add(candidate);
      }
    }
    return survivors;
  }
}
