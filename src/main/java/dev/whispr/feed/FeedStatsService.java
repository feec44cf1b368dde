package dev.whispr.feed;

import dev.whispr.review.ReplyRepository;
import dev.whispr.review.ReviewRepository;
import dev.whispr.review.VoteRepository;
import dev.whispr.user.SocialGraphRepository;
import dev.whispr.user.UnknownUserException;
import dev.whispr.user.User;
import dev.whispr.user.UserRepository;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Reads the viewer's activity counters. */
@Service
@Transactional(readOnly = true)
public class FeedStatsService {

  private final UserRepository userRepository;
  private final ReviewRepository reviewRepository;
  private final ReplyRepository replyRepository;
  private final VoteRepository voteRepository;
  private final SocialGraphRepository socialGraphRepository;

  public FeedStatsService(
      UserRepository userRepository,
      ReviewRepository reviewRepository,
      ReplyRepository replyRepository,
      VoteRepository voteRepository,
      SocialGraphRepository socialGraphRepository) {
    this.userRepository = userRepository;
    this.reviewRepository = reviewRepository;
    this.replyRepository = replyRepository;
    this.voteRepository = voteRepository;
    this.socialGraphRepository = socialGraphRepository;
  }

  /**
   * Counts the viewer's reviews, replies, votes, followers and followees.
   *
   * @throws UnknownUserException if no user has the given id
   */
  public FeedStats stats(UUID viewerId) {
    User viewer =
        userRepository.findById(viewerId).orElseThrow(() -> new UnknownUserException(viewerId));
    return new FeedStats(
        reviewRepository.countByAuthorId(viewerId),
        replyRepository.countByAuthorId(viewerId),
        voteRepository.countByUserId(viewerId),
        socialGraphRepository.countByFollowedId(viewerId),
        socialGraphRepository.countByFollowerId(viewerId),
        viewer.getEchoes());
  }
}
