package dev.fathom.project;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Project} entities. */
public interface ProjectRepository extends JpaRepository<Project, UUID> {

  Optional<Project> findByName(String name);

  boolean existsByName(String name);

  List<Project> findAllByOrderByNameAsc();
}
