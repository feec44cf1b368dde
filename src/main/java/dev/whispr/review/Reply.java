package dev.whispr.review;

import dev.whispr.user.User;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/** A reply posted under a {@link Review}. Maps to the {@code replies} table (read-only). */
@Entity
@Immutable
@Table(name = "replies")
public class Reply {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "review_id", nullable = false)
  private Review review;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "user_id", nullable = false)
  private User author;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String content;

  private int upvotes;

  private int downvotes;

  @Column(name = "is_edited")
  private boolean edited;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at")
  private Instant updatedAt;

  protected Reply() {
    // JPA requires no-arg constructor
  }

  public Reply(Review review, User author, String content) {
    this.review = review;
    this.author = author;
    this.content = content;
  }

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
    if (updatedAt == null) {
      updatedAt = createdAt;
    }
  }

  public UUID getId() {
    return id;
  }

  public Review getReview() {
    return review;
  }

  public User getAuthor() {
    return author;
  }

  public String getContent() {
    return content;
  }

  public int getUpvotes() {
    return upvotes;
  }

  public int getDownvotes() {
    return downvotes;
  }

  public boolean isEdited() {
    return edited;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
