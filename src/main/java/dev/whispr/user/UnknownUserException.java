package dev.whispr.user;

import java.util.UUID;

/** Thrown when a request names a user id that does not exist. */
public class UnknownUserException extends RuntimeException {

  public UnknownUserException(UUID userId) {
    super("Unknown user: " + userId);
  }
}
