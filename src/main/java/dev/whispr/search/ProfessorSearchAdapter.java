package dev.whispr.search;

import dev.whispr.catalog.Professor;
import dev.whispr.catalog.ProfessorRepository;
import dev.whispr.catalog.ProfessorView;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Searches professors by name. Deep mode adds the lab and the aggregated review summary, scored
 * under the {@code summary} field.
 */
@Component
public class ProfessorSearchAdapter implements EntitySearchAdapter {

  private static final Logger log = LoggerFactory.getLogger(ProfessorSearchAdapter.class);

  private final ProfessorRepository professorRepository;
  private final RelevanceScorer scorer;

  public ProfessorSearchAdapter(ProfessorRepository professorRepository, RelevanceScorer scorer) {
    this.professorRepository = professorRepository;
    this.scorer = scorer;
  }

  @Override
  public EntityType entityType() {
    return EntityType.PROFESSOR;
  }

  @Override
  public List<ScoredEntity> search(TokenSequence tokens, SearchQuery query) {
    List<String> paths =
        query.deep() ? List.of("name", "lab", "reviewSummary") : List.of("name");
    List<Professor> professors =
        professorRepository.findAll(
            SearchSpecifications.containsAnyToken(paths, tokens),
            SearchSpecifications.CANDIDATE_ORDER);
    log.debug("Professor search matched {} candidates (deep={})", professors.size(), query.deep());

    List<ScoredEntity> results = new ArrayList<>(professors.size());
    for (Professor professor : professors) {
      Map<SearchField, String> fields = new EnumMap<>(SearchField.class);
      fields.put(SearchField.NAME, professor.getName());
      if (query.deep()) {
        fields.put(SearchField.LAB, professor.getLab());
        fields.put(SearchField.SUMMARY, professor.getReviewSummary());
      }
      results.add(
          new ScoredEntity(
              EntityType.PROFESSOR,
              scorer.score(tokens, fields),
              ProfessorView.from(professor),
              professor.getCreatedAt(),
              professor.getUpdatedAt()));
    }
    return results;
  }
}
