package dev.whispr.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * A course in the campus catalog, e.g. {@code CS201 Data Structures}.
 *
 * <p>Maps to the {@code courses} table. The catalog is owned by the CRUD application; this service
 * only reads it, hence {@link Immutable}.
 *
 * @see CourseRepository
 */
@Entity
@Immutable
@Table(name = "courses")
public class Course {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, unique = true, length = 20)
  private String code;

  @Column(nullable = false)
  private String name;

  private Integer credits;

  @Column(columnDefinition = "TEXT")
  private String description;

  @Column(name = "review_summary", columnDefinition = "TEXT")
  private String reviewSummary;

  @Column(name = "review_count")
  private int reviewCount;

  @Column(name = "average_rating", precision = 3, scale = 2)
  private BigDecimal averageRating = BigDecimal.ZERO;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at")
  private Instant updatedAt;

  protected Course() {
    // JPA requires no-arg constructor
  }

  public Course(String code, String name) {
    this.code = code;
    this.name = name;
  }

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
    if (updatedAt == null) {
      updatedAt = createdAt;
    }
  }

  public UUID getId() {
    return id;
  }

  public String getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  public Integer getCredits() {
    return credits;
  }

  public void setCredits(Integer credits) {
    this.credits = credits;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getReviewSummary() {
    return reviewSummary;
  }

  public void setReviewSummary(String reviewSummary) {
    this.reviewSummary = reviewSummary;
  }

  public int getReviewCount() {
    return reviewCount;
  }

  public BigDecimal getAverageRating() {
    return averageRating;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
