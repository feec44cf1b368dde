package dev.whispr.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.whispr.fixture.ReviewBuilder;
import dev.whispr.review.Review;
import dev.whispr.review.ReviewView;
import dev.whispr.user.SocialGraphRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.random.RandomGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class FeedServiceTest {

  private static final UUID VIEWER = UUID.randomUUID();
  private static final UUID FOLLOWED = UUID.randomUUID();
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);

  @Mock SocialGraphRepository socialGraphRepository;

  @Mock FeedCandidateGenerator generator;

  /** Every trial succeeds, so phase sizes are governed by capacity alone. */
  private final RandomGenerator alwaysInclude = () -> 0L;

  FeedService feedService;

  @BeforeEach
  void setUp() {
    feedService =
        new FeedService(
            socialGraphRepository,
            generator,
            new ProbabilisticSampler(alwaysInclude, CLOCK),
            new FeedAssembler(new Random(3)));
  }

  private static List<FeedCandidate> candidates(FeedPhase phase, int count) {
    List<FeedCandidate> candidates = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      candidates.add(new FeedCandidate(new ReviewBuilder().build(), phase, 0.5));
    }
    return candidates;
  }

  private static List<UUID> ids(List<FeedCandidate> candidates) {
    return candidates.stream().map(FeedCandidate::reviewId).toList();
  }

  @Test
  void viewerFollowingNobodyGetsAnExploratoryOnlyFeed() {
    List<FeedCandidate> exploratory = candidates(FeedPhase.EXPLORATORY, 60);
    when(socialGraphRepository.findFollowedIds(VIEWER)).thenReturn(List.of());
    when(generator.social(List.of())).thenReturn(List.of());
    when(generator.exploratory(eq(VIEWER), anyCollection(), eq(20))).thenReturn(exploratory);

    List<ReviewView> feed = feedService.feed(VIEWER, new FeedRequest(0, 20));

    assertThat(feed).hasSize(20);
    assertThat(ids(exploratory)).containsAll(feed.stream().map(ReviewView::id).toList());
    verify(generator, never()).topical(any(), anyCollection(), anyCollection());
  }

  @Test
  void fullSocialPhaseSkipsLaterPhasesAndIsNotTruncatedBeforeAssembly() {
    List<FeedCandidate> social = candidates(FeedPhase.SOCIAL, 25);
    when(socialGraphRepository.findFollowedIds(VIEWER)).thenReturn(List.of(FOLLOWED));
    when(generator.social(List.of(FOLLOWED))).thenReturn(social);

    List<ReviewView> feed = feedService.feed(VIEWER, new FeedRequest(20, 20));

    // 25 social survivors reach the assembler; the second page holds the last 5
    assertThat(feed).hasSize(5);
    verify(generator, never()).topical(any(), anyCollection(), anyCollection());
    verify(generator, never()).exploratory(any(), anyCollection(), anyInt());
  }

  @Test
  void topicalTrialsStopAtTheLimitAndExploratoryIsSkipped() {
    List<FeedCandidate> social = candidates(FeedPhase.SOCIAL, 5);
    List<FeedCandidate> topical = candidates(FeedPhase.TOPICAL, 50);
    when(socialGraphRepository.findFollowedIds(VIEWER)).thenReturn(List.of(FOLLOWED));
    when(generator.social(List.of(FOLLOWED))).thenReturn(social);
    when(generator.topical(eq(VIEWER), eq(List.of(FOLLOWED)), anyCollection()))
        .thenReturn(topical);

    List<ReviewView> feed = feedService.feed(VIEWER, new FeedRequest(0, 20));

    assertThat(feed).hasSize(20);
    assertThat(feed.stream().map(ReviewView::id).toList()).containsAll(ids(social));
    verify(generator, never()).exploratory(any(), anyCollection(), anyInt());
  }

  @Test
  void exploratoryFillsTheRemainingSlots() {
    List<FeedCandidate> social = candidates(FeedPhase.SOCIAL, 3);
    List<FeedCandidate> topical = candidates(FeedPhase.TOPICAL, 2);
    when(socialGraphRepository.findFollowedIds(VIEWER)).thenReturn(List.of(FOLLOWED));
    when(generator.social(List.of(FOLLOWED))).thenReturn(social);
    when(generator.topical(eq(VIEWER), eq(List.of(FOLLOWED)), anyCollection()))
        .thenReturn(topical);
    when(generator.exploratory(eq(VIEWER), anyCollection(), eq(5)))
        .thenReturn(candidates(FeedPhase.EXPLORATORY, 15));

    List<ReviewView> feed = feedService.feed(VIEWER, new FeedRequest(0, 10));

    assertThat(feed).hasSize(10);
  }

  @Test
  void reviewSelectedByTwoPhasesAppearsOnce() {
    Review shared = new ReviewBuilder().build();
    FeedCandidate asSocial = new FeedCandidate(shared, FeedPhase.SOCIAL, 0.8);
    FeedCandidate asExploratory = new FeedCandidate(shared, FeedPhase.EXPLORATORY, 0.3);
    when(socialGraphRepository.findFollowedIds(VIEWER)).thenReturn(List.of(FOLLOWED));
    when(generator.social(List.of(FOLLOWED))).thenReturn(List.of(asSocial));
    when(generator.topical(eq(VIEWER), eq(List.of(FOLLOWED)), anyCollection()))
        .thenReturn(List.of());
    when(generator.exploratory(eq(VIEWER), anyCollection(), eq(19)))
        .thenReturn(List.of(asExploratory));

    List<ReviewView> feed = feedService.feed(VIEWER, new FeedRequest(0, 20));

    assertThat(feed).extracting(ReviewView::id).containsExactly(shared.getId());
  }

  @Test
  void emptyStoreYieldsEmptyFeed() {
    when(socialGraphRepository.findFollowedIds(VIEWER)).thenReturn(List.of());
    when(generator.social(List.of())).thenReturn(List.of());
    when(generator.exploratory(eq(VIEWER), anyCollection(), eq(20))).thenReturn(List.of());

    assertThat(feedService.feed(VIEWER, new FeedRequest(0, 20))).isEmpty();
  }
}
