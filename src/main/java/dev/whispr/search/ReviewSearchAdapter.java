package dev.whispr.search;

import dev.whispr.review.Review;
import dev.whispr.review.ReviewRepository;
import dev.whispr.review.ReviewView;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

/**
 * Searches review bodies. Takes part in deep search only. Honours the course, professor and
 * rating-range filters.
 */
@Component
public class ReviewSearchAdapter implements EntitySearchAdapter {

  private static final Logger log = LoggerFactory.getLogger(ReviewSearchAdapter.class);

  private final ReviewRepository reviewRepository;
  private final RelevanceScorer scorer;

  public ReviewSearchAdapter(ReviewRepository reviewRepository, RelevanceScorer scorer) {
    this.reviewRepository = reviewRepository;
    this.scorer = scorer;
  }

  @Override
  public EntityType entityType() {
    return EntityType.REVIEW;
  }

  @Override
  public List<ScoredEntity> search(TokenSequence tokens, SearchQuery query) {
    Specification<Review> spec =
        SearchSpecifications.<Review>containsAnyToken(List.of("content"), tokens)
            .and(SearchSpecifications.attributeEquals("course.id", query.courseId()))
            .and(SearchSpecifications.attributeEquals("professor.id", query.professorId()))
            .and(SearchSpecifications.atLeast("rating", query.minRating()))
            .and(SearchSpecifications.atMost("rating", query.maxRating()));
    List<Review> reviews = reviewRepository.findAll(spec, SearchSpecifications.CANDIDATE_ORDER);
    log.debug("Review search matched {} candidates", reviews.size());

    List<ScoredEntity> results = new ArrayList<>(reviews.size());
    for (Review review : reviews) {
      Map<SearchField, String> fields =
          Collections.singletonMap(SearchField.CONTENT, review.getContent());
      results.add(
          new ScoredEntity(
              EntityType.REVIEW,
              scorer.score(tokens, fields),
              ReviewView.from(review),
              review.getCreatedAt(),
              review.getUpdatedAt()));
    }
    return results;
  }
}
