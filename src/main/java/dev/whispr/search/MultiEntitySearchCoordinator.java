package dev.whispr.search;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Search orchestration: normalizes the query, fans out to every enabled {@link
 * EntitySearchAdapter} in parallel, waits for all of them, then merges, sorts and paginates.
 *
 * <p>Pipeline: normalize -> reject empty token sequence -> submit one task per enabled adapter ->
 * join under the configured deadline -> concatenate in {@link EntityType} order -> sort -> record
 * total -> slice {@code [skip, skip + limit)}.
 *
 * <p>The fan-out is all or nothing. When any adapter fails, or the deadline passes, every
 * outstanding task is cancelled and the request fails; a partial result is never returned. Store
 * exceptions thrown by an adapter are rethrown unchanged.
 */
@Service
public class MultiEntitySearchCoordinator {

  private static final Logger log = LoggerFactory.getLogger(MultiEntitySearchCoordinator.class);

  private final List<EntitySearchAdapter> adapters;
  private final TaskExecutor searchExecutor;
  private final SearchProperties searchProperties;

  public MultiEntitySearchCoordinator(
      List<EntitySearchAdapter> adapters,
      @Qualifier("searchExecutor") TaskExecutor searchExecutor,
      SearchProperties searchProperties) {
    this.adapters =
        adapters.stream().sorted(Comparator.comparing(EntitySearchAdapter::entityType)).toList();
    this.searchExecutor = searchExecutor;
    this.searchProperties = searchProperties;
  }

  /**
   * Runs one search.
   *
   * @param query the validated search query
   * @return the requested page with the pre-pagination total
   * @throws IllegalArgumentException if the query normalizes to no tokens
   * @throws SearchAbortedException if the fan-out times out or the caller is interrupted
   */
  public SearchResponse search(SearchQuery query) {
    TokenSequence tokens = QueryNormalizer.normalize(query.query());
    if (tokens.isEmpty()) {
      throw new IllegalArgumentException("Search query cannot be empty");
    }
    long start = System.nanoTime();

    List<EntitySearchAdapter> enabled =
        adapters.stream().filter(adapter -> query.includes(adapter.entityType())).toList();
    List<ScoredEntity> merged = fanOut(enabled, tokens, query);
    merged.sort(comparator(query.sortBy(), query.sortOrder()));

    int total = merged.size();
    int from = Math.min(query.skip(), total);
    int to = Math.min(total, from + query.limit());
    List<ScoredEntity> page = List.copyOf(merged.subList(from, to));

    log.info(
        "Search '{}' (deep={}, types={}) matched {} results in {} ms",
        query.query(),
        query.deep(),
        enabled.size(),
        total,
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    return new SearchResponse(total, page, query.query(), query.deep());
  }

  private List<ScoredEntity> fanOut(
      List<EntitySearchAdapter> enabled, TokenSequence tokens, SearchQuery query) {
    ExecutorCompletionService<List<ScoredEntity>> completion =
        new ExecutorCompletionService<>(searchExecutor);
    List<Future<List<ScoredEntity>>> futures = new ArrayList<>(enabled.size());
    Duration timeout = searchProperties.getTimeout();
    try {
      for (EntitySearchAdapter adapter : enabled) {
        futures.add(completion.submit(() -> adapter.search(tokens, query)));
      }
      long deadline = System.nanoTime() + timeout.toNanos();
      for (int i = 0; i < futures.size(); i++) {
        Future<List<ScoredEntity>> done =
            completion.poll(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        if (done == null) {
          log.warn("Search '{}' timed out after {}; cancelling adapters", query.query(), timeout);
          throw new SearchAbortedException("Search timed out after " + timeout);
        }
        done.get();
      }

      List<ScoredEntity> merged = new ArrayList<>();
      for (Future<List<ScoredEntity>> future : futures) {
        merged.addAll(future.get());
      }
      return merged;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Search '{}' interrupted; cancelling adapters", query.query());
      throw new SearchAbortedException("Search was interrupted", e);
    } catch (ExecutionException e) {
      throw rethrow(e.getCause());
    } finally {
      futures.forEach(future -> future.cancel(true));
    }
  }

  private static RuntimeException rethrow(Throwable cause) {
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return new IllegalStateException("Search adapter failed", cause);
  }

  /**
   * Relevance sorts by score. Every other field falls back to one timestamp shared by all kinds:
   * {@code updated_at} (or {@code created_at} where absent) for {@link SortField#UPDATED_AT}, else
   * {@code created_at}. The sort is stable, so ties keep adapter order.
   */
  static Comparator<ScoredEntity> comparator(SortField sortBy, SortOrder sortOrder) {
    Comparator<ScoredEntity> ascending =
        switch (sortBy) {
          case RELEVANCE -> Comparator.comparingDouble(ScoredEntity::relevanceScore);
          case UPDATED_AT -> Comparator.comparing(MultiEntitySearchCoordinator::updatedOrCreated);
          default -> Comparator.comparing(ScoredEntity::createdAt);
        };
    return sortOrder == SortOrder.DESC ? ascending.reversed() : ascending;
  }

  private static Instant updatedOrCreated(ScoredEntity entity) {
    return entity.updatedAt() != null ? entity.updatedAt() : entity.createdAt();
  }
}
