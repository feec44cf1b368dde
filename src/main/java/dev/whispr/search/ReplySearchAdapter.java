package dev.whispr.search;

import dev.whispr.review.Reply;
import dev.whispr.review.ReplyRepository;
import dev.whispr.review.ReplyView;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Searches reply bodies. Takes part in deep search only; no explicit filters. */
@Component
public class ReplySearchAdapter implements EntitySearchAdapter {

  private static final Logger log = LoggerFactory.getLogger(ReplySearchAdapter.class);

  private final ReplyRepository replyRepository;
  private final RelevanceScorer scorer;

  public ReplySearchAdapter(ReplyRepository replyRepository, RelevanceScorer scorer) {
    this.replyRepository = replyRepository;
    this.scorer = scorer;
  }

  @Override
  public EntityType entityType() {
    return EntityType.REPLY;
  }

  @Override
  public List<ScoredEntity> search(TokenSequence tokens, SearchQuery query) {
    List<Reply> replies =
        replyRepository.findAll(
            SearchSpecifications.containsAnyToken(List.of("content"), tokens),
            SearchSpecifications.CANDIDATE_ORDER);
    log.debug("Reply search matched {} candidates", replies.size());

    List<ScoredEntity> results = new ArrayList<>(replies.size());
    for (Reply reply : replies) {
      Map<SearchField, String> fields =
          Collections.singletonMap(SearchField.CONTENT, reply.getContent());
      results.add(
          new ScoredEntity(
              EntityType.REPLY,
              scorer.score(tokens, fields),
              ReplyView.from(reply),
              reply.getCreatedAt(),
              reply.getUpdatedAt()));
    }
    return results;
  }
}
