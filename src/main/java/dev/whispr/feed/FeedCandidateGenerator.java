package dev.whispr.feed;

import dev.whispr.review.Review;
import dev.whispr.review.ReviewRepository;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

/**
 * Produces the candidates of each feed phase, each tagged with its phase and inclusion
 * probability. Only fetches; sampling is left to {@link ProbabilisticSampler}.
 */
@Component
public class FeedCandidateGenerator {

  private static final Logger log = LoggerFactory.getLogger(FeedCandidateGenerator.class);

  private final ReviewRepository reviewRepository;
  private final ProbabilisticSampler sampler;
  private final FeedProperties feedProperties;
  private final Clock clock;

  public FeedCandidateGenerator(
      ReviewRepository reviewRepository,
      ProbabilisticSampler sampler,
      FeedProperties feedProperties,
      Clock clock) {
    this.reviewRepository = reviewRepository;
    this.sampler = sampler;
    this.feedProperties = feedProperties;
    this.clock = clock;
  }

  /**
   * Reviews written by followed users within the social window, newest first.
   *
   * @param followedIds users the viewer follows; empty yields no candidates
   */
  public List<FeedCandidate> social(Collection<UUID> followedIds) {
    if (followedIds.isEmpty()) {
      return List.of();
    }
    Instant since = clock.instant().minus(feedProperties.getSocialWindow());
    List<FeedCandidate> candidates =
        tag(reviewRepository.findRecentByAuthors(followedIds, since), FeedPhase.SOCIAL);
    log.debug("Social phase found {} candidates since {}", candidates.size(), since);
    return candidates;
  }

  /**
   * Reviews about the courses, professors and course offerings that followed users reviewed,
   * written by someone who is neither followed nor the viewer, newest first and capped at the
   * topical pool size.
   *
   * @param viewerId the viewer
   * @param followedIds users the viewer follows; empty yields no candidates
   * @param selectedIds reviews already in the feed, left out
   */
  public List<FeedCandidate> topical(
      UUID viewerId, Collection<UUID> followedIds, Collection<UUID> selectedIds) {
    if (followedIds.isEmpty()) {
      return List.of();
    }
    List<UUID> courseIds = reviewRepository.findReviewedCourseIds(followedIds);
    List<UUID> professorIds = reviewRepository.findReviewedProfessorIds(followedIds);
    List<UUID> offeringIds = reviewRepository.findReviewedCourseInstructorIds(followedIds);
    if (courseIds.isEmpty() && professorIds.isEmpty() && offeringIds.isEmpty()) {
      log.debug("Topical phase skipped: followed users reviewed no subjects");
      return List.of();
    }

    Specification<Review> spec =
        aboutAnySubject(courseIds, professorIds, offeringIds)
            .and(notAuthoredBy(followedIds))
            .and(notAuthoredBy(List.of(viewerId)))
            .and(notIn(selectedIds));
    PageRequest pool =
        PageRequest.of(
            0, feedProperties.getTopicalPoolSize(), Sort.by("createdAt").descending());
    List<FeedCandidate> candidates =
        tag(reviewRepository.findAll(spec, pool).getContent(), FeedPhase.TOPICAL);
    log.debug("Topical phase found {} candidates", candidates.size());
    return candidates;
  }

  /**
   * A store-side random sample of reviews not written by the viewer and not already selected,
   * sized {@code exploratory-pool-factor * remainingSlots}.
   *
   * @param viewerId the viewer
   * @param selectedIds reviews already in the feed, left out
   * @param remainingSlots open feed slots; zero or less yields no candidates
   */
  public List<FeedCandidate> exploratory(
      UUID viewerId, Collection<UUID> selectedIds, int remainingSlots) {
    if (remainingSlots <= 0) {
      return List.of();
    }
    String[] excluded = selectedIds.stream().map(UUID::toString).toArray(String[]::new);
    int poolSize = feedProperties.getExploratoryPoolFactor() * remainingSlots;
    List<FeedCandidate> candidates =
        tag(reviewRepository.sampleRandom(viewerId, excluded, poolSize), FeedPhase.EXPLORATORY);
    log.debug("Exploratory phase drew {} of {} candidates", candidates.size(), poolSize);
    return candidates;
  }

  private List<FeedCandidate> tag(List<Review> reviews, FeedPhase phase) {
    List<FeedCandidate> candidates = new ArrayList<>(reviews.size());
    for (Review review : reviews) {
      candidates.add(
          new FeedCandidate(review, phase, sampler.probability(phase, review.getCreatedAt())));
    }
    return candidates;
  }

  private static Specification<Review> aboutAnySubject(
      List<UUID> courseIds, List<UUID> professorIds, List<UUID> offeringIds) {
    return (root, query, cb) -> {
      List<Predicate> subjects = new ArrayList<>();
      if (!courseIds.isEmpty()) {
        subjects.add(root.get("course").get("id").in(courseIds));
      }
      if (!professorIds.isEmpty()) {
        subjects.add(root.get("professor").get("id").in(professorIds));
      }
      if (!offeringIds.isEmpty()) {
        subjects.add(root.get("courseInstructor").get("id").in(offeringIds));
      }
      return cb.or(subjects.toArray(Predicate[]::new));
    };
  }

  private static Specification<Review> notAuthoredBy(Collection<UUID> authorIds) {
    return (root, query, cb) -> {
      Path<UUID> authorId = root.get("author").get("id");
      return cb.not(authorId.in(authorIds));
    };
  }

  private static Specification<Review> notIn(Collection<UUID> reviewIds) {
    return (root, query, cb) -> reviewIds.isEmpty() ? null : cb.not(root.get("id").in(reviewIds));
  }
}
