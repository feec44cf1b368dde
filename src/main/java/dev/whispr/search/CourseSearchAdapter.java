package dev.whispr.search;

import dev.whispr.catalog.Course;
import dev.whispr.catalog.CourseRepository;
import dev.whispr.catalog.CourseView;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Searches courses by name and code, plus description in deep mode. No explicit filters. */
@Component
public class CourseSearchAdapter implements EntitySearchAdapter {

  private static final Logger log = LoggerFactory.getLogger(CourseSearchAdapter.class);

  private final CourseRepository courseRepository;
  private final RelevanceScorer scorer;

  public CourseSearchAdapter(CourseRepository courseRepository, RelevanceScorer scorer) {
    this.courseRepository = courseRepository;
    this.scorer = scorer;
  }

  @Override
  public EntityType entityType() {
    return EntityType.COURSE;
  }

  @Override
  public List<ScoredEntity> search(TokenSequence tokens, SearchQuery query) {
    List<String> paths =
        query.deep() ? List.of("name", "code", "description") : List.of("name", "code");
    List<Course> courses =
        courseRepository.findAll(
            SearchSpecifications.containsAnyToken(paths, tokens),
            SearchSpecifications.CANDIDATE_ORDER);
    log.debug("Course search matched {} candidates (deep={})", courses.size(), query.deep());

    List<ScoredEntity> results = new ArrayList<>(courses.size());
    for (Course course : courses) {
      Map<SearchField, String> fields = new EnumMap<>(SearchField.class);
      fields.put(SearchField.NAME, course.getName());
      fields.put(SearchField.CODE, course.getCode());
      if (query.deep()) {
        fields.put(SearchField.DESCRIPTION, course.getDescription());
      }
      results.add(
          new ScoredEntity(
              EntityType.COURSE,
              scorer.score(tokens, fields),
              CourseView.from(course),
              course.getCreatedAt(),
              course.getUpdatedAt()));
    }
    return results;
  }
}
