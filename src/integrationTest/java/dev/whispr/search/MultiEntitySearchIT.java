package dev.whispr.search;

import static org.assertj.core.api.Assertions.assertThat;

import dev.whispr.BaseIntegrationTest;
import dev.whispr.catalog.Course;
import dev.whispr.catalog.CourseInstructorRepository;
import dev.whispr.catalog.CourseInstructorView;
import dev.whispr.catalog.CourseRepository;
import dev.whispr.catalog.CourseView;
import dev.whispr.catalog.Professor;
import dev.whispr.catalog.ProfessorRepository;
import dev.whispr.catalog.ProfessorView;
import dev.whispr.fixture.CourseBuilder;
import dev.whispr.fixture.CourseInstructorBuilder;
import dev.whispr.fixture.ProfessorBuilder;
import dev.whispr.fixture.ReplyBuilder;
import dev.whispr.fixture.ReviewBuilder;
import dev.whispr.fixture.UserBuilder;
import dev.whispr.review.ReplyRepository;
import dev.whispr.review.ReplyView;
import dev.whispr.review.Review;
import dev.whispr.review.ReviewRepository;
import dev.whispr.review.ReviewView;
import dev.whispr.user.User;
import dev.whispr.user.UserRepository;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class MultiEntitySearchIT extends BaseIntegrationTest {

  @Autowired MultiEntitySearchCoordinator coordinator;

  @Autowired UserRepository userRepository;
  @Autowired CourseRepository courseRepository;
  @Autowired ProfessorRepository professorRepository;
  @Autowired CourseInstructorRepository courseInstructorRepository;
  @Autowired ReviewRepository reviewRepository;
  @Autowired ReplyRepository replyRepository;

  Course programming;
  Course networks;

  @BeforeEach
  void seedCatalog() {
    programming =
        courseRepository.save(
            new CourseBuilder()
                .code("CS101")
                .name("Intro to Programming")
                .description("Co-taught with Dr. Smith in the fall")
                .transientEntity()
                .build());
    networks =
        courseRepository.save(
            new CourseBuilder().code("CS330").name("Computer Networks").transientEntity().build());
    Professor smith =
        professorRepository.save(
            new ProfessorBuilder()
                .name("John Smith")
                .lab("Robotics Lab")
                .transientEntity()
                .build());
    professorRepository.save(
        new ProfessorBuilder().name("Mary Jones").lab("Smith Hall 210").transientEntity().build());
    courseInstructorRepository.save(
        new CourseInstructorBuilder()
            .course(programming)
            .professor(smith)
            .transientEntity()
            .build());

    User author = userRepository.save(new UserBuilder().transientEntity().build());
    Review praise =
        reviewRepository.save(
            new ReviewBuilder()
                .author(author)
                .course(programming)
                .rating(5)
                .content("Smith explains recursion really well")
                .transientEntity()
                .build());
    reviewRepository.save(
        new ReviewBuilder()
            .author(author)
            .course(networks)
            .rating(2)
            .content("Not as good as the Smith lectures")
            .transientEntity()
            .build());
    replyRepository.save(
        new ReplyBuilder()
            .review(praise)
            .author(author)
            .content("smith office hours help too")
            .transientEntity()
            .build());
  }

  @Test
  void shallowSearchMatchesNamesOnly() {
    SearchResponse response = coordinator.search(new SearchQuery("smith"));

    assertThat(keys(response))
        .containsExactlyInAnyOrder("professor:John Smith", "course_instructor:CS101");
    assertThat(response.results().get(0).relevanceScore()).isEqualTo(100.0);
  }

  @Test
  void deepSearchIsASupersetOfShallowSearch() {
    Set<String> shallow = keys(coordinator.search(new SearchQuery("smith")));
    SearchResponse deep = coordinator.search(new SearchQuery("smith", true));

    assertThat(keys(deep)).containsAll(shallow);
    assertThat(keys(deep))
        .contains(
            "professor:Mary Jones",
            "course:CS101",
            "review:Smith explains recursion really well",
            "review:Not as good as the Smith lectures",
            "reply:smith office hours help too");
    assertThat(deep.total()).isEqualTo(deep.results().size());
  }

  @Test
  void deepProfessorSearchAlsoScoresTheLab() {
    Set<EntityType> professors = Set.of(EntityType.PROFESSOR);
    SearchQuery shallow =
        new SearchQuery("smith", false, professors, null, null, null, null, null, null, 0, 100);
    SearchQuery deep =
        new SearchQuery("smith", true, professors, null, null, null, null, null, null, 0, 100);

    assertThat(keys(coordinator.search(shallow))).containsExactly("professor:John Smith");
    assertThat(keys(coordinator.search(deep)))
        .containsExactlyInAnyOrder("professor:John Smith", "professor:Mary Jones");
  }

  @Test
  void courseFilterNarrowsReviewsAndOfferings() {
    SearchQuery query =
        new SearchQuery(
            "smith",
            true,
            Set.of(EntityType.REVIEW, EntityType.COURSE_INSTRUCTOR),
            networks.getId(),
            null,
            null,
            null,
            SortField.RELEVANCE,
            SortOrder.DESC,
            0,
            100);

    assertThat(keys(coordinator.search(query)))
        .containsExactly("review:Not as good as the Smith lectures");
  }

  @Test
  void ratingBoundsApplyToReviews() {
    SearchQuery query =
        new SearchQuery(
            "smith", true, Set.of(EntityType.REVIEW), null, null, 4, 5, null, null, 0, 100);

    assertThat(keys(coordinator.search(query)))
        .containsExactly("review:Smith explains recursion really well");
  }

  @Test
  void paginationKeepsTheTotal() {
    SearchQuery page =
        new SearchQuery("smith", true, null, null, null, null, null, null, null, 2, 2);

    SearchResponse response = coordinator.search(page);

    assertThat(response.total()).isEqualTo(7);
    assertThat(response.results()).hasSize(2);
  }

  @Test
  void resultsAreOrderedByDescendingRelevance() {
    List<ScoredEntity> results = coordinator.search(new SearchQuery("smith", true)).results();

    assertThat(results)
        .extracting(ScoredEntity::relevanceScore)
        .isSortedAccordingTo((a, b) -> Double.compare(b, a));
  }

  private static Set<String> keys(SearchResponse response) {
    return response.results().stream()
        .map(MultiEntitySearchIT::key)
        .collect(Collectors.toSet());
  }

  private static String key(ScoredEntity result) {
    Object data = result.data();
    String label;
    if (data instanceof ProfessorView professor) {
      label = professor.name();
    } else if (data instanceof CourseView course) {
      label = course.code();
    } else if (data instanceof CourseInstructorView offering) {
      label = offering.course().code();
    } else if (data instanceof ReviewView review) {
      label = review.content();
    } else {
      label = ((ReplyView) data).content();
    }
    return result.entityType().value() + ":" + label;
  }
}
