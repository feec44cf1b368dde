package dev.whispr.user;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * A directed edge of the social graph: {@code followerId} follows {@code followedId}.
 *
 * <p>Maps the {@code user_followers} association table (read-only).
 *
 * @see SocialGraphRepository
 */
@Entity
@Immutable
@IdClass(FollowEdge.Key.class)
@Table(name = "user_followers")
public class FollowEdge {

  @Id
  @Column(name = "follower_id")
  private UUID followerId;

  @Id
  @Column(name = "followed_id")
  private UUID followedId;

  @Column(name = "created_at")
  private Instant createdAt;

  protected FollowEdge() {
    // JPA requires no-arg constructor
  }

  public FollowEdge(UUID followerId, UUID followedId) {
    this.followerId = followerId;
    this.followedId = followedId;
  }

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public UUID getFollowerId() {
    return followerId;
  }

  public UUID getFollowedId() {
    return followedId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  /** Composite primary key of {@link FollowEdge}. */
  public static class Key implements Serializable {

    private UUID followerId;
    private UUID followedId;

    protected Key() {}

    public Key(UUID followerId, UUID followedId) {
      this.followerId = followerId;
      this.followedId = followedId;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Key other)) {
        return false;
      }
      return Objects.equals(followerId, other.followerId)
          && Objects.equals(followedId, other.followedId);
    }

    @Override
    public int hashCode() {
      return Objects.hash(followerId, followedId);
    }
  }
}
