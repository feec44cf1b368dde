package dev.whispr.search;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Immutable search request across all entity kinds.
 *
 * <p>Filters narrow the kinds that support them:
 *
 * <ul>
 *   <li>{@code courseId}, {@code professorId} - course offerings and reviews
 *   <li>{@code minRating}, {@code maxRating} - reviews
 * </ul>
 *
 * @param query the raw query text (must not be blank; tokens are derived later)
 * @param deep whether long-form text fields and reviews/replies are searched
 * @param entityTypes kinds to search; {@code null} or empty means all kinds
 * @param courseId optional course filter
 * @param professorId optional professor filter
 * @param minRating optional inclusive lower rating bound, 1 to 5
 * @param maxRating optional inclusive upper rating bound, 1 to 5
 * @param sortBy ordering of merged results; {@code null} means relevance
 * @param sortOrder sort direction; {@code null} means descending
 * @param skip number of merged results to skip (>= 0)
 * @param limit maximum results returned (1 to {@value #MAX_LIMIT})
 */
public record SearchQuery(
    String query,
    boolean deep,
    Set<EntityType> entityTypes,
    @Nullable UUID courseId,
    @Nullable UUID professorId,
    @Nullable Integer minRating,
    @Nullable Integer maxRating,
    SortField sortBy,
    SortOrder sortOrder,
    int skip,
    int limit) {

  public static final int MAX_LIMIT = 100;
  private static final int MIN_RATING = 1;
  private static final int MAX_RATING = 5;

  /** Compact constructor validating input and applying defaults. */
  public SearchQuery {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Search query cannot be empty");
    }
    checkRating("min_rating", minRating);
    checkRating("max_rating", maxRating);
    if (skip < 0) {
      throw new IllegalArgumentException("skip must be at least 0");
    }
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
    entityTypes =
        entityTypes == null || entityTypes.isEmpty()
            ? Set.copyOf(EnumSet.allOf(EntityType.class))
            : Set.copyOf(entityTypes);
    sortBy = sortBy == null ? SortField.RELEVANCE : sortBy;
    sortOrder = sortOrder == null ? SortOrder.DESC : sortOrder;
  }

  /** Shallow search of every kind, relevance-ordered, first {@value #MAX_LIMIT} results. */
  public SearchQuery(String query) {
    this(query, false);
  }

  /** Search of every kind with the given depth, relevance-ordered, first page. */
  public SearchQuery(String query, boolean deep) {
    this(
        query, deep, null, null, null, null, null, SortField.RELEVANCE, SortOrder.DESC, 0,
        MAX_LIMIT);
  }

  /**
   * Returns whether results of the given kind are part of this search. Review and reply search
   * additionally requires deep mode.
   */
  public boolean includes(EntityType type) {
    return entityTypes.contains(type) && (deep || !type.deepOnly());
  }

  private static void checkRating(String name, @Nullable Integer rating) {
    if (rating != null && (rating < MIN_RATING || rating > MAX_RATING)) {
      throw new IllegalArgumentException(
          name + " must be between " + MIN_RATING + " and " + MAX_RATING);
    }
  }
}
