package dev.whispr.user;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link User} entities. */
public interface UserRepository extends JpaRepository<User, UUID> {}
