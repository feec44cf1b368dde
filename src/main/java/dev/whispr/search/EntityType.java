package dev.whispr.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kinds of content that search fans out to. Declaration order is the order in which adapter
 * results are merged before sorting, which decides ties.
 */
public enum EntityType {
  COURSE("course", false),
  PROFESSOR("professor", false),
  COURSE_INSTRUCTOR("course_instructor", false),
  /** Long-form user content; searched in deep mode only. */
  REVIEW("review", true),
  /** Long-form user content; searched in deep mode only. */
  REPLY("reply", true);

  private final String value;
  private final boolean deepOnly;

  EntityType(String value, boolean deepOnly) {
    this.value = value;
    this.deepOnly = deepOnly;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean deepOnly() {
    return deepOnly;
  }

  /**
   * Parses a wire value such as {@code "course_instructor"}. Matching is case-insensitive.
   *
   * @throws IllegalArgumentException if the value names no entity type
   */
  @JsonCreator
  public static EntityType fromValue(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (EntityType type : values()) {
      if (type.value.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown entity type: " + value);
  }
}
