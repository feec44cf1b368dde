package dev.whispr;

import static org.assertj.core.api.Assertions.assertThat;

import dev.whispr.catalog.Course;
import dev.whispr.catalog.CourseInstructor;
import dev.whispr.catalog.CourseInstructorRepository;
import dev.whispr.catalog.CourseRepository;
import dev.whispr.catalog.Professor;
import dev.whispr.catalog.ProfessorRepository;
import dev.whispr.fixture.CourseBuilder;
import dev.whispr.fixture.CourseInstructorBuilder;
import dev.whispr.fixture.ProfessorBuilder;
import dev.whispr.fixture.ReplyBuilder;
import dev.whispr.fixture.ReviewBuilder;
import dev.whispr.fixture.UserBuilder;
import dev.whispr.review.Reply;
import dev.whispr.review.ReplyRepository;
import dev.whispr.review.Review;
import dev.whispr.review.ReviewRepository;
import dev.whispr.review.Vote;
import dev.whispr.review.VoteRepository;
import dev.whispr.user.FollowEdge;
import dev.whispr.user.SocialGraphRepository;
import dev.whispr.user.User;
import dev.whispr.user.UserRepository;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compensates for ddl-auto=validate only checking column presence by verifying each JPA entity can
 * be persisted and read back against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

  private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");

  @Autowired UserRepository userRepository;
  @Autowired SocialGraphRepository socialGraphRepository;
  @Autowired CourseRepository courseRepository;
  @Autowired ProfessorRepository professorRepository;
  @Autowired CourseInstructorRepository courseInstructorRepository;
  @Autowired ReviewRepository reviewRepository;
  @Autowired ReplyRepository replyRepository;
  @Autowired VoteRepository voteRepository;

  @Test
  void userAndFollowEdgeRoundtrip() {
    User alice =
        userRepository.saveAndFlush(new UserBuilder().username("alice").transientEntity().build());
    User bob =
        userRepository.saveAndFlush(new UserBuilder().username("bob").transientEntity().build());
    socialGraphRepository.saveAndFlush(new FollowEdge(alice.getId(), bob.getId()));

    User found = userRepository.findById(alice.getId()).orElseThrow();
    assertThat(found.getUsername()).isEqualTo("alice");
    assertThat(found.getCreatedAt()).isNotNull();
    assertThat(socialGraphRepository.findFollowedIds(alice.getId())).containsExactly(bob.getId());
    assertThat(socialGraphRepository.countByFollowedId(bob.getId())).isEqualTo(1);
    assertThat(socialGraphRepository.countByFollowerId(bob.getId())).isZero();
  }

  @Test
  void catalogEntitiesRoundtrip() {
    Course course =
        courseRepository.saveAndFlush(
            new CourseBuilder()
                .code("CS240")
                .name("Operating Systems")
                .description("Processes, threads and scheduling")
                .createdAt(CREATED)
                .transientEntity()
                .build());
    Professor professor =
        professorRepository.saveAndFlush(
            new ProfessorBuilder().name("Ada Park").lab("Systems Lab").transientEntity().build());
    CourseInstructor offering =
        courseInstructorRepository.saveAndFlush(
            new CourseInstructorBuilder()
                .course(course)
                .professor(professor)
                .semester("Spring")
                .year(2025)
                .transientEntity()
                .build());

    Course foundCourse = courseRepository.findById(course.getId()).orElseThrow();
    assertThat(foundCourse.getCode()).isEqualTo("CS240");
    assertThat(foundCourse.getDescription()).isEqualTo("Processes, threads and scheduling");
    assertThat(foundCourse.getCreatedAt()).isEqualTo(CREATED);
    assertThat(foundCourse.getUpdatedAt()).isEqualTo(CREATED);
    assertThat(professorRepository.findById(professor.getId()).orElseThrow().getLab())
        .isEqualTo("Systems Lab");
    CourseInstructor foundOffering =
        courseInstructorRepository.findById(offering.getId()).orElseThrow();
    assertThat(foundOffering.getSemester()).isEqualTo("Spring");
    assertThat(foundOffering.getYear()).isEqualTo(2025);
    assertThat(foundOffering.getCourse().getId()).isEqualTo(course.getId());
  }

  @Test
  void reviewReplyAndVoteRoundtrip() {
    User author = userRepository.saveAndFlush(new UserBuilder().transientEntity().build());
    Course course = courseRepository.saveAndFlush(new CourseBuilder().transientEntity().build());
    Review review =
        reviewRepository.saveAndFlush(
            new ReviewBuilder()
                .author(author)
                .course(course)
                .rating(5)
                .content("Best lectures on campus")
                .createdAt(CREATED)
                .transientEntity()
                .build());
    Reply reply =
        replyRepository.saveAndFlush(
            new ReplyBuilder().review(review).author(author).transientEntity().build());
    voteRepository.saveAndFlush(new Vote(author.getId(), review.getId(), null, true));

    Review found = reviewRepository.findById(review.getId()).orElseThrow();
    assertThat(found.getRating()).isEqualTo(5);
    assertThat(found.getContent()).isEqualTo("Best lectures on campus");
    assertThat(found.getCourse().getId()).isEqualTo(course.getId());
    assertThat(found.getCreatedAt()).isEqualTo(CREATED);
    assertThat(found.getSemester()).isNull();
    assertThat(found.getYear()).isNull();
    assertThat(replyRepository.findById(reply.getId()).orElseThrow().getContent())
        .isEqualTo("Agreed, the labs were great.");
    assertThat(reviewRepository.countByAuthorId(author.getId())).isEqualTo(1);
    assertThat(replyRepository.countByAuthorId(author.getId())).isEqualTo(1);
    assertThat(voteRepository.countByUserId(author.getId())).isEqualTo(1);
  }
}
