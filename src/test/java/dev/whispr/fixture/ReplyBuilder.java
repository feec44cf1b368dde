package dev.whispr.fixture;

import dev.whispr.review.Reply;
import dev.whispr.review.Review;
import dev.whispr.user.User;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Test builder for the {@link Reply} entity. */
public final class ReplyBuilder {

  private @Nullable UUID id = UUID.randomUUID();
  private @Nullable Review review;
  private @Nullable User author;
  private String content = "Agreed, the labs were great.";
  private @Nullable Instant createdAt = Instant.parse("2024-01-01T00:00:00Z");
  private @Nullable Instant updatedAt;

  public ReplyBuilder id(@Nullable UUID id) {
    this.id = id;
    return this;
  }

  public ReplyBuilder review(Review review) {
    this.review = review;
    return this;
  }

  public ReplyBuilder author(User author) {
    this.author = author;
    return this;
  }

  public ReplyBuilder content(String content) {
    this.content = content;
    return this;
  }

  public ReplyBuilder createdAt(@Nullable Instant createdAt) {
    this.createdAt = createdAt;
    return this;
  }

  public ReplyBuilder updatedAt(@Nullable Instant updatedAt) {
    this.updatedAt = updatedAt;
    return this;
  }

  /** Builds a reply without id, ready to be persisted. */
  public ReplyBuilder transientEntity() {
    this.id = null;
    return this;
  }

  public Reply build() {
    Reply reply =
        new Reply(
            review != null ? review : new ReviewBuilder().build(),
            author != null ? author : new UserBuilder().build(),
            content);
    if (id != null) {
      Fields.set(reply, "id", id);
    }
    if (createdAt != null) {
      Fields.set(reply, "createdAt", createdAt);
    }
    if (updatedAt != null) {
      Fields.set(reply, "updatedAt", updatedAt);
    }
    return reply;
  }
}
