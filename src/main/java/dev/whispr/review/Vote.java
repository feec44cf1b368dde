package dev.whispr.review;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * An up- or downvote on exactly one review or reply. Only counted here, never ranked on.
 *
 * <p>Maps to the {@code votes} table (read-only).
 */
@Entity
@Immutable
@Table(name = "votes")
public class Vote {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "review_id")
  private UUID reviewId;

  @Column(name = "reply_id")
  private UUID replyId;

  /** {@code true} for an upvote. */
  @Column(name = "vote_type", nullable = false)
  private boolean upvote;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Vote() {
    // JPA requires no-arg constructor
  }

  public Vote(UUID userId, UUID reviewId, UUID replyId, boolean upvote) {
    this.userId = userId;
    this.reviewId = reviewId;
    this.replyId = replyId;
    this.upvote = upvote;
  }

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public UUID getReviewId() {
    return reviewId;
  }

  public UUID getReplyId() {
    return replyId;
  }

  public boolean isUpvote() {
    return upvote;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
