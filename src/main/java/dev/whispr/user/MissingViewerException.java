package dev.whispr.user;

/** Thrown when a request needs a viewer but carries no valid viewer identity. */
public class MissingViewerException extends RuntimeException {

  public MissingViewerException(String message) {
    super(message);
  }

  public MissingViewerException(String message, Throwable cause) {
    super(message, cause);
  }
}
