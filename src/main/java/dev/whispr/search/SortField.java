package dev.whispr.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Requested ordering of merged search results.
 *
 * <p>Only {@link #RELEVANCE} orders by score. Every other value orders the merged, mixed-kind list
 * by entity timestamp: {@link #UPDATED_AT} by last update (falling back to creation for kinds
 * without one), all others by creation time.
 */
public enum SortField {
  RELEVANCE("relevance"),
  NAME("name"),
  CODE("code"),
  RATING("rating"),
  CREATED_AT("created_at"),
  UPDATED_AT("updated_at");

  private final String value;

  SortField(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Parses a wire value such as {@code "created_at"}.
   *
   * @throws IllegalArgumentException if the value names no sort field
   */
  @JsonCreator
  public static SortField fromValue(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (SortField field : values()) {
      if (field.value.equals(normalized)) {
        return field;
      }
    }
    throw new IllegalArgumentException("Unknown sort field: " + value);
  }
}
