package dev.whispr.api;

import dev.whispr.search.EntityType;
import dev.whispr.search.MultiEntitySearchCoordinator;
import dev.whispr.search.SearchQuery;
import dev.whispr.search.SearchResponse;
import dev.whispr.search.SortField;
import dev.whispr.search.SortOrder;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Free-text search across courses, professors, course offerings, reviews and replies. */
@RestController
@RequestMapping("/api/v1/search")
public class SearchController {

  private final MultiEntitySearchCoordinator coordinator;

  public SearchController(MultiEntitySearchCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  @GetMapping
  public SearchResponse search(
      @RequestParam(required = false) @Nullable String query,
      @RequestParam(defaultValue = "false") boolean deep,
      @RequestParam(name = "entity_types", required = false) @Nullable List<EntityType> entityTypes,
      @RequestParam(name = "course_id", required = false) @Nullable UUID courseId,
      @RequestParam(name = "professor_id", required = false) @Nullable UUID professorId,
      @RequestParam(name = "min_rating", required = false) @Nullable Integer minRating,
      @RequestParam(name = "max_rating", required = false) @Nullable Integer maxRating,
      @RequestParam(name = "sort_by", defaultValue = "relevance") SortField sortBy,
      @RequestParam(name = "sort_order", defaultValue = "desc") SortOrder sortOrder,
      @RequestParam(defaultValue = "0") int skip,
      @RequestParam(defaultValue = "100") int limit) {
    return coordinator.search(
        new SearchQuery(
            query,
            deep,
            entityTypes == null ? null : Set.copyOf(entityTypes),
            courseId,
            professorId,
            minRating,
            maxRating,
            sortBy,
            sortOrder,
            skip,
            limit));
  }

  @PostMapping
  public SearchResponse search(@RequestBody SearchRequestBody body) {
    return coordinator.search(body.toQuery());
  }
}
