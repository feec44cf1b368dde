package dev.whispr.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Sort direction of merged search results. */
public enum SortOrder {
  ASC,
  DESC;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses {@code "asc"} or {@code "desc"}, case-insensitively.
   *
   * @throws IllegalArgumentException for any other value
   */
  @JsonCreator
  public static SortOrder fromValue(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (SortOrder order : values()) {
      if (order.value().equals(normalized)) {
        return order;
      }
    }
    throw new IllegalArgumentException("Unknown sort order: " + value);
  }
}
