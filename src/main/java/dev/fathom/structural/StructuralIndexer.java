package dev.fathom.structural;

import dev.fathom.indexing.IndexArtifact;
import dev.fathom.indexing.ProjectLocks;
import dev.fathom.process.ProcessOutcome;
import dev.fathom.process.ProcessRunner;
import dev.fathom.project.ProjectRegistry;
import dev.fathom.project.ProjectRemovedEvent;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Builds a project's SCIP index by running {@code scip-java index} in the project root.
 *
 * <p>The build tool detected by scip-java (Maven, Gradle, sbt) must be usable in that directory.
 * The previous index, if any, is overwritten in place, and it is deleted when the project is
 * removed.
 */
@Service
public class StructuralIndexer {

  private static final Logger log = LoggerFactory.getLogger(StructuralIndexer.class);

  private static final int STDERR_TAIL = 2000;

  private final ProjectRegistry projectRegistry;
  private final StructuralIndexLocator locator;
  private final ProcessRunner processRunner;
  private final ProjectLocks projectLocks;
  private final StructuralProperties properties;
  private final Clock clock;

  public StructuralIndexer(
      ProjectRegistry projectRegistry,
      StructuralIndexLocator locator,
      ProcessRunner processRunner,
      ProjectLocks projectLocks,
      StructuralProperties properties,
      Clock clock) {
    this.projectRegistry = projectRegistry;
    this.locator = locator;
    this.processRunner = processRunner;
    this.projectLocks = projectLocks;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Builds the SCIP index of a registered project.
   *
   * @throws dev.fathom.project.ProjectNotFoundException if the project is not registered
   * @throws dev.fathom.indexing.IndexingInProgressException if a build already runs
   * @throws StructuralIndexerException if scip-java is missing, fails or times out
   */
  public StructuralIndexResult buildIndex(String projectName) {
    return projectLocks.runExclusive(
        projectName, IndexArtifact.STRUCTURAL, () -> doBuildIndex(projectName));
  }

  /** Deletes the SCIP index of a removed project. */
  @TransactionalEventListener(fallbackExecution = true)
  public void onProjectRemoved(ProjectRemovedEvent event) {
    Path indexPath = locator.indexFor(event.projectName());
    try {
      if (Files.deleteIfExists(indexPath)) {
        log.info("Deleted SCIP index {} of removed project '{}'", indexPath, event.projectName());
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot delete SCIP index " + indexPath, e);
    }
  }

  private StructuralIndexResult doBuildIndex(String projectName) {
    Path root = projectRegistry.resolve(projectName);
    Path indexPath = locator.indexFor(projectName);
    try {
      Files.createDirectories(indexPath.getParent());
    } catch (IOException e) {
      throw new StructuralIndexerException(
          projectName,
          StructuralIndexerException.Kind.PROCESS_FAILURE,
          "Cannot create index directory " + indexPath.getParent(),
          e);
    }

    List<String> command =
        List.of(properties.getIndexerCommand(), "index", "--output", indexPath.toString());
    log.info("Building SCIP index of project '{}' into {}", projectName, indexPath);
    Instant started = clock.instant();
    ProcessOutcome outcome = processRunner.run(command, root, properties.getIndexerTimeout());

    if (outcome instanceof ProcessOutcome.ExecutableNotFound notFound) {
      throw new StructuralIndexerException(
          projectName,
          StructuralIndexerException.Kind.UNAVAILABLE,
          "Structural indexer '%s' not found. Is scip-java installed and on the PATH?"
              .formatted(notFound.executable()));
    }
    if (outcome instanceof ProcessOutcome.StartFailed startFailed) {
      throw new StructuralIndexerException(
          projectName,
          StructuralIndexerException.Kind.PROCESS_FAILURE,
          "Could not start '%s' in %s: %s"
              .formatted(startFailed.executable(), root, startFailed.message()));
    }
    if (outcome instanceof ProcessOutcome.TimedOut timedOut) {
      throw new StructuralIndexerException(
          projectName,
          StructuralIndexerException.Kind.TIMEOUT,
          "Structural indexing of '%s' timed out after %s".formatted(projectName, timedOut.timeout()));
    }
    ProcessOutcome.Completed completed = (ProcessOutcome.Completed) outcome;
    if (!completed.isSuccess()) {
      throw new StructuralIndexerException(
          projectName,
          StructuralIndexerException.Kind.PROCESS_FAILURE,
          "scip-java exited with %d: %s"
              .formatted(completed.exitCode(), tail(completed.stderr())));
    }
    if (!Files.isRegularFile(indexPath)) {
      throw new StructuralIndexerException(
          projectName,
          StructuralIndexerException.Kind.PROCESS_FAILURE,
          "scip-java finished but wrote no index at " + indexPath);
    }

    Duration elapsed = Duration.between(started, clock.instant());
    log.info("SCIP index of project '{}' built in {}", projectName, elapsed);
    return new StructuralIndexResult(projectName, indexPath, elapsed);
  }

  private static String tail(String stderr) {
    String trimmed = stderr.strip();
    return trimmed.length() <= STDERR_TAIL
        ? trimmed
        : trimmed.substring(trimmed.length() - STDERR_TAIL);
  }
}
