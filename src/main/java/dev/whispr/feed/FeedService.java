package dev.whispr.feed;

import dev.whispr.review.ReviewView;
import dev.whispr.user.SocialGraphRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds a viewer's personalized, partly randomized feed.
 *
 * <p>Phases run sequentially: social candidates are sampled in full; topical and exploratory
 * candidates are fetched and sampled only while the feed is under {@code limit}, and their trials
 * stop as soon as it is reached. The sampled survivors are then deduplicated, shuffled and paged by
 * {@link FeedAssembler}. Read-only; nothing is cached between requests.
 */
@Service
@Transactional(readOnly = true)
public class FeedService {

  private static final Logger log = LoggerFactory.getLogger(FeedService.class);

  private final SocialGraphRepository socialGraphRepository;
  private final FeedCandidateGenerator generator;
  private final ProbabilisticSampler sampler;
  private final FeedAssembler assembler;

  public FeedService(
      SocialGraphRepository socialGraphRepository,
      FeedCandidateGenerator generator,
      ProbabilisticSampler sampler,
      FeedAssembler assembler) {
    this.socialGraphRepository = socialGraphRepository;
    this.generator = generator;
    this.sampler = sampler;
    this.assembler = assembler;
  }

  /**
   * Assembles one feed page for the viewer.
   *
   * @param viewerId the requesting user
   * @param request pagination; {@code limit} is also the target feed size
   * @return reviews with their author and subjects, at most {@code limit} of them
   */
  public List<ReviewView> feed(UUID viewerId, FeedRequest request) {
    List<UUID> followedIds = socialGraphRepository.findFollowedIds(viewerId);
    List<FeedCandidate> selected = new ArrayList<>();

    List<FeedCandidate> social = generator.social(followedIds);
    List<FeedCandidate> socialSurvivors = sampler.sample(social, Integer.MAX_VALUE);
    selected.addAll(socialSurvivors);
    log.debug("Social phase kept {} of {}", socialSurvivors.size(), social.size());

    if (!followedIds.isEmpty() && selected.size() < request.limit()) {
      List<FeedCandidate> topical = generator.topical(viewerId, followedIds, ids(selected));
      List<FeedCandidate> survivors = sampler.sample(topical, request.limit() - selected.size());
      selected.addAll(survivors);
      log.debug("Topical phase kept {} of {}", survivors.size(), topical.size());
    }

    if (selected.size() < request.limit()) {
      int remainingSlots = request.limit() - selected.size();
      List<FeedCandidate> exploratory =
          generator.exploratory(viewerId, ids(selected), remainingSlots);
      List<FeedCandidate> survivors = sampler.sample(exploratory, remainingSlots);
      selected.addAll(survivors);
      log.debug("Exploratory phase kept {} of {}", survivors.size(), exploratory.size());
    }

    return assembler.assemble(selected, request).stream().map(ReviewView::from).toList();
  }

  private static Set<UUID> ids(List<FeedCandidate> candidates) {
    return candidates.stream().map(FeedCandidate::reviewId).collect(Collectors.toSet());
  }
}
