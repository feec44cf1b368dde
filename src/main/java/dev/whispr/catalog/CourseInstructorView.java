package dev.whispr.catalog;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Read projection of a {@link CourseInstructor} carrying the joined course and professor, so a
 * client can render the offering without further lookups.
 */
public record CourseInstructorView(
    UUID id,
    @Nullable String semester,
    @Nullable Integer year,
    @Nullable String summary,
    int reviewCount,
    BigDecimal averageRating,
    Instant createdAt,
    CourseView course,
    ProfessorView professor) {

  public static CourseInstructorView from(CourseInstructor offering) {
    return new CourseInstructorView(
        offering.getId(),
        offering.getSemester(),
        offering.getYear(),
        offering.getSummary(),
        offering.getReviewCount(),
        offering.getAverageRating(),
        offering.getCreatedAt(),
        CourseView.from(offering.getCourse()),
        ProfessorView.from(offering.getProfessor()));
  }
}
