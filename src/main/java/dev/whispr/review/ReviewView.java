package dev.whispr.review;

import dev.whispr.catalog.CourseInstructorView;
import dev.whispr.catalog.CourseView;
import dev.whispr.catalog.ProfessorView;
import dev.whispr.user.AuthorView;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Read projection of a {@link Review} with its author and every subject it is about. Shared by
 * search results and feed items.
 */
public record ReviewView(
    UUID id,
    int rating,
    @Nullable String content,
    @Nullable String semester,
    @Nullable Integer year,
    int upvotes,
    int downvotes,
    boolean edited,
    Instant createdAt,
    @Nullable Instant updatedAt,
    AuthorView author,
    @Nullable CourseView course,
    @Nullable ProfessorView professor,
    @Nullable CourseInstructorView courseInstructor) {

  public static ReviewView from(Review review) {
    return new ReviewView(
        review.getId(),
        review.getRating(),
        review.getContent(),
        review.getSemester(),
        review.getYear(),
        review.getUpvotes(),
        review.getDownvotes(),
        review.isEdited(),
        review.getCreatedAt(),
        review.getUpdatedAt(),
        AuthorView.from(review.getAuthor()),
        review.getCourse() != null ? CourseView.from(review.getCourse()) : null,
        review.getProfessor() != null ? ProfessorView.from(review.getProfessor()) : null,
        review.getCourseInstructor() != null
            ? CourseInstructorView.from(review.getCourseInstructor())
            : null);
  }
}
