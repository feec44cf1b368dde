package dev.whispr.search;

import dev.whispr.catalog.CourseInstructor;
import dev.whispr.catalog.CourseInstructorRepository;
import dev.whispr.catalog.CourseInstructorView;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

/**
 * Searches course offerings through their joined course and professor: course name and code,
 * professor name and semester. Deep mode adds the course description, the professor lab and the
 * offering summary. Honours the {@code courseId} and {@code professorId} filters.
 */
@Component
public class CourseInstructorSearchAdapter implements EntitySearchAdapter {

  private static final Logger log = LoggerFactory.getLogger(CourseInstructorSearchAdapter.class);

  private static final List<String> SHALLOW_PATHS =
      List.of("course.name", "course.code", "professor.name", "semester");
  private static final List<String> DEEP_PATHS =
      List.of(
          "course.name",
          "course.code",
          "professor.name",
          "semester",
          "course.description",
          "professor.lab",
          "summary");

  private final CourseInstructorRepository courseInstructorRepository;
  private final RelevanceScorer scorer;

  public CourseInstructorSearchAdapter(
      CourseInstructorRepository courseInstructorRepository, RelevanceScorer scorer) {
    this.courseInstructorRepository = courseInstructorRepository;
    this.scorer = scorer;
  }

  @Override
  public EntityType entityType() {
    return EntityType.COURSE_INSTRUCTOR;
  }

  @Override
  public List<ScoredEntity> search(TokenSequence tokens, SearchQuery query) {
    Specification<CourseInstructor> spec =
        SearchSpecifications.<CourseInstructor>containsAnyToken(
                query.deep() ? DEEP_PATHS : SHALLOW_PATHS, tokens)
            .and(SearchSpecifications.attributeEquals("course.id", query.courseId()))
            .and(SearchSpecifications.attributeEquals("professor.id", query.professorId()));
    List<CourseInstructor> offerings =
        courseInstructorRepository.findAll(spec, SearchSpecifications.CANDIDATE_ORDER);
    log.debug(
        "Course-instructor search matched {} candidates (deep={})", offerings.size(), query.deep());

    List<ScoredEntity> results = new ArrayList<>(offerings.size());
    for (CourseInstructor offering : offerings) {
      Map<SearchField, String> fields = new EnumMap<>(SearchField.class);
      fields.put(SearchField.COURSE_NAME, offering.getCourse().getName());
      fields.put(SearchField.COURSE_CODE, offering.getCourse().getCode());
      fields.put(SearchField.PROFESSOR_NAME, offering.getProfessor().getName());
      fields.put(SearchField.SEMESTER, offering.getSemester());
      if (query.deep()) {
        fields.put(SearchField.COURSE_DESCRIPTION, offering.getCourse().getDescription());
        fields.put(SearchField.PROFESSOR_LAB, offering.getProfessor().getLab());
        fields.put(SearchField.SUMMARY, offering.getSummary());
      }
      results.add(
          new ScoredEntity(
              EntityType.COURSE_INSTRUCTOR,
              scorer.score(tokens, fields),
              CourseInstructorView.from(offering),
              offering.getCreatedAt(),
              null));
    }
    return results;
  }
}
