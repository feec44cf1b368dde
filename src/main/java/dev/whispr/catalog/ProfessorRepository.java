package dev.whispr.catalog;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

/** Spring Data repository for {@link Professor} entities. */
public interface ProfessorRepository
    extends JpaRepository<Professor, UUID>, JpaSpecificationExecutor<Professor> {}
