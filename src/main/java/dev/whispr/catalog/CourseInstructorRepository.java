package dev.whispr.catalog;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

/** Spring Data repository for {@link CourseInstructor} entities. */
public interface CourseInstructorRepository
    extends JpaRepository<CourseInstructor, UUID>, JpaSpecificationExecutor<CourseInstructor> {

  /**
   * Finds offerings matching the specification with their course and professor fetched in the
   * same query, so callers can project them outside a transaction.
   */
  @Override
  @EntityGraph(attributePaths = {"course", "professor"})
  List<CourseInstructor> findAll(Specification<CourseInstructor> spec, Sort sort);
}
