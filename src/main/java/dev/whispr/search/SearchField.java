package dev.whispr.search;

/**
 * Closed set of logical fields that search scores. Identity-like fields are searched always,
 * free-text fields only in deep mode.
 */
public enum SearchField {
  NAME("name", 5.0),
  CODE("code", 5.0),
  DESCRIPTION("description", 2.0),
  CONTENT("content", 1.0),
  LAB("lab", 2.0),
  SUMMARY("summary", 1.5),
  COURSE_NAME("course_name", 4.0),
  COURSE_CODE("course_code", 4.0),
  PROFESSOR_NAME("professor_name", 4.0),
  SEMESTER("semester", 3.0),
  COURSE_DESCRIPTION("course_description", 1.5),
  PROFESSOR_LAB("professor_lab", 1.5);

  private final String key;
  private final double defaultWeight;

  SearchField(String key, double defaultWeight) {
    this.key = key;
    this.defaultWeight = defaultWeight;
  }

  /** The field name used in the weight table and in {@code whispr.search.field-weights}. */
  public String key() {
    return key;
  }

  public double defaultWeight() {
    return defaultWeight;
  }
}
