package dev.whispr.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for the scoring properties: field scores stay in [0, 100] and hit 100
 * exactly on a phrase match; combined scores stay in [1, 100].
 */
class RelevanceScorerPropertyTest {

  private final RelevanceScorer scorer = new RelevanceScorer(FieldWeightTable.defaults());

  @Provide
  Arbitrary<TokenSequence> tokenSequences() {
    return Arbitraries.strings()
        .withCharRange('a', 'e')
        .ofMinLength(1)
        .ofMaxLength(3)
        .list()
        .ofMinSize(1)
        .ofMaxSize(4)
        .map(TokenSequence::new);
  }

  @Provide
  Arbitrary<String> texts() {
    return Arbitraries.strings()
        .withCharRange('a', 'e')
        .withChars(' ', 'A', 'B', '1')
        .ofMaxLength(30);
  }

  @Provide
  Arbitrary<Map<String, Double>> fieldScores() {
    return Arbitraries.maps(
            Arbitraries.of(List.of("name", "code", "content", "summary", "unlisted")),
            Arbitraries.doubles().between(0.0, 100.0))
        .ofMaxSize(5);
  }

  @Property
  void fieldScoreStaysInBounds(
      @ForAll("tokenSequences") TokenSequence tokens, @ForAll("texts") String text) {
    double score = RelevanceScorer.scoreField(tokens, text);

    assertThat(score).isBetween(0.0, 100.0);
  }

  @Property
  void fieldScoreIsHundredExactlyOnPhraseMatch(
      @ForAll("tokenSequences") TokenSequence tokens, @ForAll("texts") String text) {
    boolean phrasePresent = text.toLowerCase(Locale.ROOT).contains(tokens.phrase());

    assertThat(RelevanceScorer.scoreField(tokens, text) == 100.0).isEqualTo(phrasePresent);
  }

  @Property
  void combinedScoreStaysInBounds(@ForAll("fieldScores") Map<String, Double> scores) {
    assertThat(scorer.combine(scores)).isBetween(1.0, 100.0);
  }

  @Property
  void combinedScoreIgnoresZeroEntries(@ForAll("fieldScores") Map<String, Double> scores) {
    Map<String, Double> withoutZeros =
        scores.entrySet().stream()
            .filter(entry -> entry.getValue() != 0.0)
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));

    assertThat(scorer.combine(scores)).isCloseTo(scorer.combine(withoutZeros), within(0.1));
  }
}
