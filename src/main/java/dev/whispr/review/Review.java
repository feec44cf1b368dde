package dev.whispr.review;

import dev.whispr.catalog.Course;
import dev.whispr.catalog.CourseInstructor;
import dev.whispr.catalog.Professor;
import dev.whispr.user.User;
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
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * An anonymous review of a course, a professor, or a specific course offering. At least one of the
 * three subjects is set; the rating is 1 to 5.
 *
 * <p>Maps to the {@code reviews} table (read-only).
 *
 * @see ReviewRepository
 */
@Entity
@Immutable
@Table(name = "reviews")
public class Review {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "user_id", nullable = false)
  private User author;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "course_id")
  private Course course;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "professor_id")
  private Professor professor;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "course_instructor_id")
  private CourseInstructor courseInstructor;

  @Column(nullable = false)
  private int rating;

  @Column(columnDefinition = "TEXT")
  private String content;

  @Column(columnDefinition = "TEXT")
  private String semester;

  private Integer year;

  private int upvotes;

  private int downvotes;

  @Column(name = "is_edited")
  private boolean edited;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at")
  private Instant updatedAt;

  protected Review() {
    // JPA requires no-arg constructor
  }

  public Review(User author, int rating, String content) {
    this.author = author;
    this.rating = rating;
    this.content = content;
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

  public User getAuthor() {
    return author;
  }

  public Course getCourse() {
    return course;
  }

  public void setCourse(Course course) {
    this.course = course;
  }

  public Professor getProfessor() {
    return professor;
  }

  public void setProfessor(Professor professor) {
    this.professor = professor;
  }

  public CourseInstructor getCourseInstructor() {
    return courseInstructor;
  }

  public void setCourseInstructor(CourseInstructor courseInstructor) {
    this.courseInstructor = courseInstructor;
  }

  public int getRating() {
    return rating;
  }

  public String getContent() {
    return content;
  }

  public String getSemester() {
    return semester;
  }

  public Integer getYear() {
    return year;
  }

  public int getUpvotes() {
    return upvotes;
  }

  public int getDownvotes() {
    return downvotes;
  }

  public boolean isEdited() {
    return edited;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
