package dev.whispr.search;

import java.util.List;

/**
 * Searches one {@link EntityType}: fetches the candidates whose searched fields contain any query
 * token (narrowed by the filters the kind supports), scores each candidate and projects it.
 *
 * <p>Implementations hold no mutable state and may be invoked concurrently with each other.
 */
public interface EntitySearchAdapter {

  EntityType entityType();

  /**
   * Fetches, scores and projects the matching candidates of this kind.
   *
   * @param tokens the normalized, non-empty query tokens
   * @param query the full query, for the deep flag and filters
   * @return every matching candidate, unsorted and unpaginated
   */
  List<ScoredEntity> search(TokenSequence tokens, SearchQuery query);
}
