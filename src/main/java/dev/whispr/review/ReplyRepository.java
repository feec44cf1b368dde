package dev.whispr.review;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link Reply} entities. */
public interface ReplyRepository
    extends JpaRepository<Reply, UUID>, JpaSpecificationExecutor<Reply> {

  @Override
  @EntityGraph(attributePaths = {"author"})
  List<Reply> findAll(Specification<Reply> spec, Sort sort);

  /** Number of replies written by the given user. */
  @Query("SELECT COUNT(r) FROM Reply r WHERE r.author.id = :authorId")
  long countByAuthorId(@Param("authorId") UUID authorId);
}
