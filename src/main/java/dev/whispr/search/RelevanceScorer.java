package dev.whispr.search;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Two-stage relevance scoring: every field is scored locally on a bounded [0, 100] scale, then the
 * non-zero field scores are combined into a weighted average.
 *
 * <p>Per field, an exact occurrence of the whole query phrase scores {@value #PHRASE_SCORE};
 * otherwise the score is the share of query tokens found as substrings, capped at {@value
 * #PARTIAL_CAP} so a partial match never ties an exact one. Combination weights come from the
 * {@link FieldWeightTable}, which lets a precise hit in a short, salient field (course code,
 * person name) outrank scattered hits in long free text.
 *
 * <p>Scoring is deterministic and stateless.
 */
@Component
public class RelevanceScorer {

  static final double PHRASE_SCORE = 100.0;
  static final double PARTIAL_CAP = 95.0;

  /** Score of a candidate that matched only through a filter, never through its text. */
  static final double FLOOR_SCORE = 1.0;

  private final FieldWeightTable weights;

  public RelevanceScorer(FieldWeightTable weights) {
    this.weights = weights;
  }

  /**
   * Scores one text field against the query tokens.
   *
   * @param tokens the normalized, non-empty query tokens
   * @param text the field value; {@code null} or empty scores 0
   * @return a score in [0, 100]
   */
  public static double scoreField(TokenSequence tokens, @Nullable String text) {
    if (text == null || text.isEmpty() || tokens.isEmpty()) {
      return 0.0;
    }
    String haystack = text.toLowerCase(Locale.ROOT);
    if (haystack.contains(tokens.phrase())) {
      return PHRASE_SCORE;
    }
    long matched = tokens.tokens().stream().filter(haystack::contains).count();
    return Math.min(PARTIAL_CAP, 100.0 * matched / tokens.size());
  }

  /**
   * Combines per-field scores into one candidate score.
   *
   * @param fieldScores field name to score in [0, 100]; zero entries carry no signal
   * @return {@value #FLOOR_SCORE} if no field scored, else the weighted average rounded to one
   *     decimal and clamped to [1, 100]
   */
  public double combine(Map<String, Double> fieldScores) {
    double weightedSum = 0.0;
    double weightTotal = 0.0;
    for (Map.Entry<String, Double> entry : fieldScores.entrySet()) {
      double score = entry.getValue();
      if (score == 0.0) {
        continue;
      }
      double weight = weights.weight(entry.getKey());
      weightedSum += score * weight;
      weightTotal += weight;
    }
    if (weightTotal == 0.0) {
      return FLOOR_SCORE;
    }
    double rounded = Math.round(weightedSum / weightTotal * 10.0) / 10.0;
    return Math.max(FLOOR_SCORE, Math.min(PHRASE_SCORE, rounded));
  }

  /**
   * Scores each field of a candidate and combines the results.
   *
   * @param tokens the normalized, non-empty query tokens
   * @param fieldTexts the searched fields of one candidate; values may be {@code null}
   * @return the combined score in [1, 100]
   */
  public double score(TokenSequence tokens, Map<SearchField, String> fieldTexts) {
    Map<String, Double> fieldScores = new LinkedHashMap<>();
    fieldTexts.forEach((field, text) -> fieldScores.put(field.key(), scoreField(tokens, text)));
    return combine(fieldScores);
  }
}
