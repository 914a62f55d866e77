package dev.fathom.project;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistent mapping from project name to canonical root path and last semantic index time.
 *
 * <p>Every mutating operation touches a single row and runs in its own transaction; the unique
 * constraint on {@code projects.name} settles concurrent registrations of the same name. Lookups
 * never return {@code null}: an unknown name is reported with {@link ProjectNotFoundException}.
 */
@Service
public class ProjectRegistry {

  private static final Logger log = LoggerFactory.getLogger(ProjectRegistry.class);

  private final ProjectRepository projectRepository;
  private final Clock clock;
  private final ApplicationEventPublisher eventPublisher;

  public ProjectRegistry(
      ProjectRepository projectRepository, Clock clock, ApplicationEventPublisher eventPublisher) {
    this.projectRepository = projectRepository;
    this.clock = clock;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Registers a project under a new name.
   *
   * @param name unique project name
   * @param path project root, canonicalised before storing
   * @return the generated project id
   * @throws ProjectAlreadyExistsException if the name is already registered
   */
  public UUID register(String name, Path path) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Project name must not be blank");
    }
    if (projectRepository.existsByName(name)) {
      throw new ProjectAlreadyExistsException(name);
    }
    Path canonical = ProjectPaths.canonicalize(path);
    try {
      Project saved = projectRepository.saveAndFlush(new Project(name, canonical.toString()));
      log.info("Project '{}' registered at '{}'", name, canonical);
      return saved.getId();
    } catch (DataIntegrityViolationException e) {
      throw new ProjectAlreadyExistsException(name, e);
    }
  }

  /**
   * Resolves a project name to its canonical root path.
   *
   * @throws ProjectNotFoundException if the name is not registered
   */
  public Path resolve(String name) {
    return get(name).getRoot();
  }

  /**
   * Returns the registered project.
   *
   * @throws ProjectNotFoundException if the name is not registered
   */
  public Project get(String name) {
    return projectRepository.findByName(name).orElseThrow(() -> new ProjectNotFoundException(name));
  }

  public Optional<Project> find(String name) {
    return projectRepository.findByName(name);
  }

  /** Lists all registered projects ordered by name. */
  public List<Project> list() {
    return projectRepository.findAllByOrderByNameAsc();
  }

  /**
   * Records that a semantic index run finished now.
   *
   * @throws ProjectNotFoundException if the name is not registered
   */
  @Transactional
  public Instant touch(String name) {
    Project project = get(name);
    Instant now = clock.instant();
    project.setLastIndexedAt(now);
    projectRepository.save(project);
    log.info("Project '{}' last_indexed_at updated to {}", name, now);
    return now;
  }

  /**
   * Removes a project. Removing an unknown name is a no-op.
   *
   * <p>A {@link ProjectRemovedEvent} is published for a removed project; its snippet collection
   * and SCIP index are deleted once the transaction commits.
   *
   * @return true if a project was removed
   */
  @Transactional
  public boolean remove(String name) {
    Optional<Project> found = projectRepository.findByName(name);
    if (found.isEmpty()) {
      log.debug("Project '{}' not registered, nothing to remove", name);
      return false;
    }
    projectRepository.delete(found.get());
    eventPublisher.publishEvent(new ProjectRemovedEvent(name));
    log.info("Project '{}' removed", name);
    return true;
  }
}
