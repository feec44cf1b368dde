package dev.whispr.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import dev.whispr.fixture.ReplyBuilder;
import dev.whispr.fixture.ReviewBuilder;
import dev.whispr.review.Review;
import dev.whispr.review.ReplyRepository;
import dev.whispr.review.ReplyView;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class ReplySearchAdapterTest {

  @Mock ReplyRepository replyRepository;

  @Test
  void scoresContentAndCarriesParentReviewId() {
    Review parent = new ReviewBuilder().build();
    when(replyRepository.findAll(any(Specification.class), any(Sort.class)))
        .thenReturn(
            List.of(new ReplyBuilder().review(parent).content("The midterm was fair").build()));
    ReplySearchAdapter adapter =
        new ReplySearchAdapter(replyRepository, new RelevanceScorer(FieldWeightTable.defaults()));

    List<ScoredEntity> results =
        adapter.search(
            SearchFixtures.tokens("midterm", "final"), new SearchQuery("midterm final", true));

    ScoredEntity hit = results.get(0);
    assertThat(hit.entityType()).isEqualTo(EntityType.REPLY);
    assertThat(hit.relevanceScore()).isEqualTo(50.0);
    assertThat(((ReplyView) hit.data()).reviewId()).isEqualTo(parent.getId());
  }
}
