package dev.whispr.search;

import java.util.List;
import java.util.Set;

/** Shorthand for building normalized tokens and narrowed queries in search tests. */
final class SearchFixtures {

  private SearchFixtures() {}

  static TokenSequence tokens(String... tokens) {
    return new TokenSequence(List.of(tokens));
  }

  static SearchQuery restrictedTo(SearchQuery query, EntityType... types) {
    return new SearchQuery(
        query.query(),
        query.deep(),
        Set.of(types),
        query.courseId(),
        query.professorId(),
        query.minRating(),
        query.maxRating(),
        query.sortBy(),
        query.sortOrder(),
        query.skip(),
        query.limit());
  }
}
