package dev.whispr.api;

import dev.whispr.feed.FeedRequest;
import dev.whispr.feed.FeedService;
import dev.whispr.feed.FeedStats;
import dev.whispr.feed.FeedStatsService;
import dev.whispr.review.ReviewView;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** The viewer's personalized feed and activity counters. */
@RestController
@RequestMapping("/api/v1/feed")
public class FeedController {

  private final FeedService feedService;
  private final FeedStatsService feedStatsService;

  public FeedController(FeedService feedService, FeedStatsService feedStatsService) {
    this.feedService = feedService;
    this.feedStatsService = feedStatsService;
  }

  /** One page of the feed. Identical requests may return different reviews and orders. */
  @GetMapping
  public List<ReviewView> feed(
      Viewer viewer,
      @RequestParam(defaultValue = "0") int skip,
      @RequestParam(defaultValue = "20") int limit) {
    return feedService.feed(viewer.id(), new FeedRequest(skip, limit));
  }

  @GetMapping("/stats")
  public FeedStats stats(Viewer viewer) {
    return feedStatsService.stats(viewer.id());
  }
}
