package dev.whispr.feed;

/**
 * Activity counters of one user, shown next to their feed.
 *
 * @param reviewCount reviews written
 * @param replyCount replies written
 * @param voteCount votes cast
 * @param followersCount users following them
 * @param followingCount users they follow
 * @param echoes reputation points, owned by the account service
 */
public record FeedStats(
    long reviewCount,
    long replyCount,
    long voteCount,
    long followersCount,
    long followingCount,
    int echoes) {}
