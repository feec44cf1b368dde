package dev.whispr.fixture;

import dev.whispr.catalog.Course;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Test builder for the {@link Course} entity.
 *
 * <pre>{@code
 * Course course = new CourseBuilder().code("CS201").name("Data Structures").build();
 * }</pre>
 */
public final class CourseBuilder {

  private @Nullable UUID id = UUID.randomUUID();
  private String code = "CS101";
  private String name = "Introduction to Computer Science";
  private @Nullable String description;
  private @Nullable String reviewSummary;
  private @Nullable Instant createdAt = Instant.parse("2024-01-01T00:00:00Z");
  private @Nullable Instant updatedAt;

  public CourseBuilder id(@Nullable UUID id) {
    this.id = id;
    return this;
  }

  public CourseBuilder code(String code) {
    this.code = code;
    return this;
  }

  public CourseBuilder name(String name) {
    this.name = name;
    return this;
  }

  public CourseBuilder description(@Nullable String description) {
    this.description = description;
    return this;
  }

  public CourseBuilder reviewSummary(@Nullable String reviewSummary) {
    this.reviewSummary = reviewSummary;
    return this;
  }

  public CourseBuilder createdAt(@Nullable Instant createdAt) {
    this.createdAt = createdAt;
    return this;
  }

  public CourseBuilder updatedAt(@Nullable Instant updatedAt) {
    this.updatedAt = updatedAt;
    return this;
  }

  /** Builds a course without id, ready to be persisted. */
  public CourseBuilder transientEntity() {
    this.id = null;
    return this;
  }

  public Course build() {
    Course course = new Course(code, name);
    course.setDescription(description);
    course.setReviewSummary(reviewSummary);
    if (id != null) {
      Fields.set(course, "id", id);
    }
    if (createdAt != null) {
      Fields.set(course, "createdAt", createdAt);
    }
    if (updatedAt != null) {
      Fields.set(course, "updatedAt", updatedAt);
    }
    return course;
  }
}
