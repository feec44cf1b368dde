package dev.whispr.catalog;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Read projection of a {@link Course} as rendered in search results and feed items. */
public record CourseView(
    UUID id,
    String code,
    String name,
    @Nullable Integer credits,
    @Nullable String description,
    @Nullable String reviewSummary,
    int reviewCount,
    BigDecimal averageRating,
    Instant createdAt,
    @Nullable Instant updatedAt) {

  public static CourseView from(Course course) {
    return new CourseView(
        course.getId(),
        course.getCode(),
        course.getName(),
        course.getCredits(),
        course.getDescription(),
        course.getReviewSummary(),
        course.getReviewCount(),
        course.getAverageRating(),
        course.getCreatedAt(),
        course.getUpdatedAt());
  }
}
