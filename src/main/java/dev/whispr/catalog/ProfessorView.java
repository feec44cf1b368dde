package dev.whispr.catalog;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Read projection of a {@link Professor}. */
public record ProfessorView(
    UUID id,
    String name,
    @Nullable String lab,
    @Nullable String reviewSummary,
    int reviewCount,
    BigDecimal averageRating,
    Instant createdAt,
    @Nullable Instant updatedAt) {

  public static ProfessorView from(Professor professor) {
    return new ProfessorView(
        professor.getId(),
        professor.getName(),
        professor.getLab(),
        professor.getReviewSummary(),
        professor.getReviewCount(),
        professor.getAverageRating(),
        professor.getCreatedAt(),
        professor.getUpdatedAt());
  }
}
