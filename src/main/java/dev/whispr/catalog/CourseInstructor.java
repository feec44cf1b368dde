package dev.whispr.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * A professor's offering of a course in a given term. Unique per professor, course, semester and
 * year.
 *
 * <p>Maps to the {@code course_instructors} table (read-only). The table has no {@code updated_at}
 * column.
 */
@Entity
@Immutable
@Table(name = "course_instructors")
public class CourseInstructor {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "course_id", nullable = false)
  private Course course;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "professor_id", nullable = false)
  private Professor professor;

  @Column(length = 20)
  private String semester;

  private Integer year;

  @Column(columnDefinition = "TEXT")
  private String summary;

  @Column(name = "review_count")
  private int reviewCount;

  @Column(name = "average_rating", precision = 3, scale = 2)
  private BigDecimal averageRating = BigDecimal.ZERO;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CourseInstructor() {
    // JPA requires no-arg constructor
  }

  public CourseInstructor(Course course, Professor professor, String semester, Integer year) {
    this.course = course;
    this.professor = professor;
    this.semester = semester;
    this.year = year;
  }

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public UUID getId() {
    return id;
  }

  public Course getCourse() {
    return course;
  }

  public Professor getProfessor() {
    return professor;
  }

  public String getSemester() {
    return semester;
  }

  public Integer getYear() {
    return year;
  }

  public String getSummary() {
    return summary;
  }

  public void setSummary(String summary) {
    this.summary = summary;
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
}
