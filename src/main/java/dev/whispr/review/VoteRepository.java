package dev.whispr.review;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Vote} entities. */
public interface VoteRepository extends JpaRepository<Vote, UUID> {

  long countByUserId(UUID userId);
}
