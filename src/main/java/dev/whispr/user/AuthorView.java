package dev.whispr.user;

import java.util.UUID;

/** Public author attribution attached to reviews and replies. */
public record AuthorView(UUID id, String username) {

  public static AuthorView from(User user) {
    return new AuthorView(user.getId(), user.getUsername());
  }
}
