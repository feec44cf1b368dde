package dev.whispr.user;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Read access to the follower graph. */
public interface SocialGraphRepository extends JpaRepository<FollowEdge, FollowEdge.Key> {

  /**
   * Returns the ids of every user the given user follows.
   *
   * @param followerId the following user
   * @return followed user ids, empty if the user follows no one
   */
  @Query("SELECT f.followedId FROM FollowEdge f WHERE f.followerId = :followerId")
  List<UUID> findFollowedIds(@Param("followerId") UUID followerId);

  /** Number of users following {@code followedId}. */
  long countByFollowedId(UUID followedId);

  /** Number of users {@code followerId} follows. */
  long countByFollowerId(UUID followerId);
}
