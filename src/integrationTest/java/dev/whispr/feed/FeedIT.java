package dev.whispr.feed;

import static org.assertj.core.api.Assertions.assertThat;

import dev.whispr.BaseIntegrationTest;
import dev.whispr.catalog.Course;
import dev.whispr.catalog.CourseRepository;
import dev.whispr.fixture.CourseBuilder;
import dev.whispr.fixture.ReviewBuilder;
import dev.whispr.fixture.UserBuilder;
import dev.whispr.review.Review;
import dev.whispr.review.ReviewRepository;
import dev.whispr.review.ReviewView;
import dev.whispr.user.FollowEdge;
import dev.whispr.user.SocialGraphRepository;
import dev.whispr.user.User;
import dev.whispr.user.UserRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

@Transactional
class FeedIT extends BaseIntegrationTest {

  @Autowired FeedService feedService;
  @Autowired FeedCandidateGenerator generator;
  @Autowired FeedStatsService feedStatsService;

  @Autowired UserRepository userRepository;
  @Autowired SocialGraphRepository socialGraphRepository;
  @Autowired CourseRepository courseRepository;
  @Autowired ReviewRepository reviewRepository;

  User viewer;
  User followed;
  User stranger;
  Course sharedCourse;
  Course otherCourse;

  Review followedRecent;
  Review followedOld;
  Review strangerOnSharedCourse;
  Review strangerOnOtherCourse;
  Review viewersOwn;

  @BeforeEach
  void seedGraph() {
    Instant now = Instant.now();
    viewer = user("viewer");
    followed = user("followed");
    stranger = user("stranger");
    socialGraphRepository.save(new FollowEdge(viewer.getId(), followed.getId()));

    sharedCourse = course("MA201");
    otherCourse = course("HI110");

    followedRecent = review(followed, sharedCourse, now.minus(Duration.ofDays(1)));
    followedOld = review(followed, sharedCourse, now.minus(Duration.ofDays(30)));
    strangerOnSharedCourse = review(stranger, sharedCourse, now.minus(Duration.ofDays(2)));
    strangerOnOtherCourse = review(stranger, otherCourse, now.minus(Duration.ofDays(3)));
    viewersOwn = review(viewer, sharedCourse, now.minus(Duration.ofHours(5)));
  }

  @Test
  void socialPhaseReturnsOnlyRecentReviewsByFollowees() {
    List<FeedCandidate> social = generator.social(List.of(followed.getId()));

    assertThat(social).extracting(FeedCandidate::reviewId).containsExactly(followedRecent.getId());
    assertThat(social).allMatch(candidate -> candidate.sourcePhase() == FeedPhase.SOCIAL);
    assertThat(social).allMatch(candidate -> candidate.inclusionProbability() == 0.8);
  }

  @Test
  void topicalPhaseFindsStrangersOnSubjectsFolloweesReviewed() {
    List<FeedCandidate> topical =
        generator.topical(viewer.getId(), List.of(followed.getId()), Set.of());

    assertThat(topical)
        .extracting(FeedCandidate::reviewId)
        .containsExactly(strangerOnSharedCourse.getId());
  }

  @Test
  void topicalPhaseSkipsAlreadySelectedReviews() {
    List<FeedCandidate> topical =
        generator.topical(
            viewer.getId(), List.of(followed.getId()), Set.of(strangerOnSharedCourse.getId()));

    assertThat(topical).isEmpty();
  }

  @Test
  void exploratoryPhaseExcludesViewerAndSelectedReviews() {
    List<FeedCandidate> exploratory =
        generator.exploratory(viewer.getId(), Set.of(followedRecent.getId()), 10);

    assertThat(exploratory)
        .extracting(FeedCandidate::reviewId)
        .containsExactlyInAnyOrder(
            followedOld.getId(), strangerOnSharedCourse.getId(), strangerOnOtherCourse.getId());
  }

  @Test
  void exploratoryPhaseFetchesAtMostThreeCandidatesPerSlot() {
    List<FeedCandidate> exploratory = generator.exploratory(viewer.getId(), Set.of(), 1);

    assertThat(exploratory).hasSize(3);
  }

  @RepeatedTest(10)
  void feedNeverContainsDuplicatesOrTheViewersOwnReviews() {
    List<ReviewView> feed = feedService.feed(viewer.getId(), new FeedRequest(0, 20));

    assertThat(feed).hasSizeLessThanOrEqualTo(20);
    assertThat(feed).extracting(ReviewView::id).doesNotHaveDuplicates();
    assertThat(feed).extracting(ReviewView::id).doesNotContain(viewersOwn.getId());
    assertThat(feed).allMatch(review -> review.author() != null);
  }

  @RepeatedTest(5)
  void viewerFollowingNobodyOnlySeesOtherPeoplesReviews() {
    User loner = user("loner");

    List<ReviewView> feed = feedService.feed(loner.getId(), new FeedRequest(0, 2));

    assertThat(feed).hasSizeLessThanOrEqualTo(2);
    assertThat(feed).extracting(review -> review.author().id()).doesNotContain(loner.getId());
  }

  @Test
  void statsCountActivityAndFollowers() {
    FeedStats stats = feedStatsService.stats(viewer.getId());

    assertThat(stats.reviewCount()).isEqualTo(1);
    assertThat(stats.replyCount()).isZero();
    assertThat(stats.followingCount()).isEqualTo(1);
    assertThat(stats.followersCount()).isZero();
    assertThat(feedStatsService.stats(followed.getId()).followersCount()).isEqualTo(1);
  }

  private User user(String username) {
    return userRepository.save(new UserBuilder().username(username).transientEntity().build());
  }

  private Review review(User author, Course course, Instant createdAt) {
    return reviewRepository.saveAndFlush(
        new ReviewBuilder()
            .author(author)
            .course(course)
            .content("Review by " + author.getUsername())
            .createdAt(createdAt)
            .transientEntity()
            .build());
  }

  private Course course(String code) {
    return courseRepository.save(new CourseBuilder().code(code).transientEntity().build());
  }
}
