package dev.whispr.review;

import dev.whispr.user.AuthorView;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Read projection of a {@link Reply} with its author and parent review id. */
public record ReplyView(
    UUID id,
    UUID reviewId,
    String content,
    int upvotes,
    int downvotes,
    boolean edited,
    Instant createdAt,
    @Nullable Instant updatedAt,
    AuthorView author) {

  public static ReplyView from(Reply reply) {
    return new ReplyView(
        reply.getId(),
        reply.getReview().getId(),
        reply.getContent(),
        reply.getUpvotes(),
        reply.getDownvotes(),
        reply.isEdited(),
        reply.getCreatedAt(),
        reply.getUpdatedAt(),
        AuthorView.from(reply.getAuthor()));
  }
}
