package dev.whispr.review;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Spring Data repository for {@link Review} entities.
 *
 * <p>Finder methods used for rendering fetch the author and every review subject in the same
 * query.
 */
public interface ReviewRepository
    extends JpaRepository<Review, UUID>, JpaSpecificationExecutor<Review> {

  @Override
  @EntityGraph(
      attributePaths = {
        "author",
        "course",
        "professor",
        "courseInstructor.course",
        "courseInstructor.professor"
      })
  List<Review> findAll(Specification<Review> spec, Sort sort);

  @Override
  @EntityGraph(
      attributePaths = {
        "author",
        "course",
        "professor",
        "courseInstructor.course",
        "courseInstructor.professor"
      })
  Page<Review> findAll(Specification<Review> spec, Pageable pageable);

  /**
   * Returns reviews written by any of the given authors at or after {@code since}, newest first.
   *
   * @param authorIds the authors to include (must not be empty)
   * @param since inclusive lower bound on {@code created_at}
   * @return matching reviews with author and subjects fetched
   */
  @EntityGraph(
      attributePaths = {
        "author",
        "course",
        "professor",
        "courseInstructor.course",
        "courseInstructor.professor"
      })
  @Query(
      "SELECT r FROM Review r WHERE r.author.id IN :authorIds AND r.createdAt >= :since"
          + " ORDER BY r.createdAt DESC")
  List<Review> findRecentByAuthors(
      @Param("authorIds") Collection<UUID> authorIds, @Param("since") Instant since);

  /** Distinct courses reviewed by any of the given authors. */
  @Query(
      "SELECT DISTINCT r.course.id FROM Review r"
          + " WHERE r.author.id IN :authorIds AND r.course IS NOT NULL")
  List<UUID> findReviewedCourseIds(@Param("authorIds") Collection<UUID> authorIds);

  /** Distinct professors reviewed by any of the given authors. */
  @Query(
      "SELECT DISTINCT r.professor.id FROM Review r"
          + " WHERE r.author.id IN :authorIds AND r.professor IS NOT NULL")
  List<UUID> findReviewedProfessorIds(@Param("authorIds") Collection<UUID> authorIds);

  /** Distinct course offerings reviewed by any of the given authors. */
  @Query(
      "SELECT DISTINCT r.courseInstructor.id FROM Review r"
          + " WHERE r.author.id IN :authorIds AND r.courseInstructor IS NOT NULL")
  List<UUID> findReviewedCourseInstructorIds(@Param("authorIds") Collection<UUID> authorIds);

  /**
   * Draws a uniform random sample of reviews not written by the viewer and not already selected.
   * Sampling happens in PostgreSQL; relations load lazily, so call inside a transaction.
   *
   * @param viewerId the viewer whose own reviews are excluded
   * @param excludedIds review ids to leave out (may be empty)
   * @param limit maximum number of rows
   * @return at most {@code limit} reviews in random order
   */
  @Query(
      value =
          """
            SELECT * FROM reviews
            WHERE user_id <> :viewerId
              AND NOT (id = ANY(CAST(:excludedIds AS uuid[])))
            ORDER BY random()
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Review> sampleRandom(
      @Param("viewerId") UUID viewerId,
      @Param("excludedIds") String[] excludedIds,
      @Param("limit") int limit);

  /** Number of reviews written by the given user. */
  @Query("SELECT COUNT(r) FROM Review r WHERE r.author.id = :authorId")
  long countByAuthorId(@Param("authorId") UUID authorId);
}
