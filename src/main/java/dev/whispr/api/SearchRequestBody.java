package dev.whispr.api;

import dev.whispr.search.EntityType;
import dev.whispr.search.SearchQuery;
import dev.whispr.search.SortField;
import dev.whispr.search.SortOrder;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code POST /api/v1/search}. Property names are snake_case on the wire; absent
 * properties take the same defaults as the query-parameter form.
 */
public record SearchRequestBody(
    @Nullable String query,
    @Nullable Boolean deep,
    @Nullable List<EntityType> entityTypes,
    @Nullable UUID courseId,
    @Nullable UUID professorId,
    @Nullable Integer minRating,
    @Nullable Integer maxRating,
    @Nullable SortField sortBy,
    @Nullable SortOrder sortOrder,
    @Nullable Integer skip,
    @Nullable Integer limit) {

  /**
   * Converts to a validated query.
   *
   * @throws IllegalArgumentException if any field is out of range
   */
  SearchQuery toQuery() {
    return new SearchQuery(
        query,
        Boolean.TRUE.equals(deep),
        entityTypes == null ? null : Set.copyOf(entityTypes),
        courseId,
        professorId,
        minRating,
        maxRating,
        sortBy,
        sortOrder,
        skip == null ? 0 : skip,
        limit == null ? SearchQuery.MAX_LIMIT : limit);
  }
}
