package dev.whispr.feed;

/**
 * The three candidate sources of a feed, in the order they run. The order is also the precedence
 * when the same review comes out of more than one phase.
 */
public enum FeedPhase {
  /** Recent reviews by users the viewer follows. */
  SOCIAL,
  /** Reviews about subjects the viewer's followees have reviewed. */
  TOPICAL,
  /** A random sample of everything else. */
  EXPLORATORY
}
