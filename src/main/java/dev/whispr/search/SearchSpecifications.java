package dev.whispr.search;

import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

/**
 * Builds the JPA {@link Specification}s shared by the entity search adapters.
 *
 * <p>Attribute paths may traverse to-one associations with dots, e.g. {@code course.name}.
 */
final class SearchSpecifications {

  /** Newest first, id as tie-breaker, so candidate order is stable between identical requests. */
  static final Sort CANDIDATE_ORDER = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.asc("id"));

  private SearchSpecifications() {}

  /**
   * Matches entities where any of the given attributes contains any of the tokens,
   * case-insensitively. Tokens are alphanumeric, so they need no LIKE escaping.
   */
  static <T> Specification<T> containsAnyToken(List<String> attributePaths, TokenSequence tokens) {
    return (root, query, cb) -> {
      List<Predicate> predicates = new ArrayList<>();
      for (String token : tokens.tokens()) {
        for (String attributePath : attributePaths) {
          predicates.add(cb.like(cb.lower(resolve(root, attributePath)), "%" + token + "%"));
        }
      }
      return cb.or(predicates.toArray(Predicate[]::new));
    };
  }

  /** Matches entities whose attribute equals the value; matches everything when value is null. */
  static <T> Specification<T> attributeEquals(String attributePath, @Nullable Object value) {
    return (root, query, cb) ->
        value == null ? null : cb.equal(resolve(root, attributePath), value);
  }

  /** Inclusive lower bound on an integer attribute; no-op when bound is null. */
  static <T> Specification<T> atLeast(String attribute, @Nullable Integer bound) {
    return (root, query, cb) ->
        bound == null ? null : cb.greaterThanOrEqualTo(root.get(attribute), bound);
  }

  /** Inclusive upper bound on an integer attribute; no-op when bound is null. */
  static <T> Specification<T> atMost(String attribute, @Nullable Integer bound) {
    return (root, query, cb) ->
        bound == null ? null : cb.lessThanOrEqualTo(root.get(attribute), bound);
  }

  @SuppressWarnings("unchecked")
  private static <Y> Path<Y> resolve(Path<?> root, String attributePath) {
    Path<?> path = root;
    for (String part : attributePath.split("\\.")) {
      path = path.get(part);
    }
    return (Path<Y>) path;
  }
}
