package dev.fathom.dependency;

import dev.fathom.project.ProjectAlreadyExistsException;
import dev.fathom.project.ProjectRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns the source jars of a local Maven repository into registered projects.
 *
 * <p>Every {@code <artifact>-<version>-sources.jar} is extracted into {@code
 * <extract-dir>/dep_<artifact>-<version>} and registered under that directory name, so the
 * library can be indexed and searched like any other project. A jar whose directory already
 * exists is skipped. A corrupt jar is logged and counted as failed without stopping the run.
 */
@Service
public class DependencySourceImporter {

  static final String SOURCES_SUFFIX = "-sources.jar";
  static final String PROJECT_PREFIX = "dep_";

  private static final Logger log = LoggerFactory.getLogger(DependencySourceImporter.class);

  private final ProjectRegistry projectRegistry;
  private final DependencyImportProperties properties;

  public DependencySourceImporter(
      ProjectRegistry projectRegistry, DependencyImportProperties properties) {
    this.projectRegistry = projectRegistry;
    this.properties = properties;
  }

  /** Imports every source jar found under the configured Maven repository. */
  public DependencyImportResult importAll() {
    Path extractRoot = Path.of(properties.getExtractDir()).toAbsolutePath().normalize();
    List<Path> jars = findSourceJars(Path.of(properties.getMavenRepository()));

    List<String> imported = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    List<String> failed = new ArrayList<>();
    for (Path jar : jars) {
      String projectName = projectNameFor(jar);
      switch (importJar(jar, projectName, extractRoot.resolve(projectName))) {
        case IMPORTED -> imported.add(projectName);
        case SKIPPED -> skipped.add(projectName);
        case FAILED -> failed.add(projectName);
      }
    }
    log.info(
        "Dependency import finished: {} imported, {} skipped, {} failed",
        imported.size(),
        skipped.size(),
        failed.size());
    return new DependencyImportResult(imported, skipped, failed);
  }

  /** Lists {@code *-sources.jar} files below {@code repository}, sorted by path. */
  List<Path> findSourceJars(Path repository) {
    if (!Files.isDirectory(repository)) {
      log.warn("Maven repository not found: {}", repository);
      return List.of();
    }
    try (Stream<Path> files = Files.walk(repository)) {
      List<Path> jars =
          files
              .filter(Files::isRegularFile)
              .filter(file -> file.getFileName().toString().endsWith(SOURCES_SUFFIX))
              .sorted()
              .toList();
      log.info("Found {} source jar(s) in {}", jars.size(), repository);
      return jars;
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot scan Maven repository " + repository, e);
    }
  }

  static String projectNameFor(Path jar) {
    String fileName = jar.getFileName().toString();
    return PROJECT_PREFIX + fileName.substring(0, fileName.length() - SOURCES_SUFFIX.length());
  }

  private Outcome importJar(Path jar, String projectName, Path target) {
    if (Files.exists(target)) {
      log.debug("Dependency '{}' already extracted, skipping", projectName);
      return Outcome.SKIPPED;
    }
    try {
      extract(jar, target);
    } catch (IOException e) {
      log.warn("Could not extract {}: {}", jar.getFileName(), e.getMessage());
      deleteTree(target);
      return Outcome.FAILED;
    }
    try {
      projectRegistry.register(projectName, target);
      log.info("Dependency '{}' extracted and registered", projectName);
      return Outcome.IMPORTED;
    } catch (ProjectAlreadyExistsException e) {
      log.info("Dependency '{}' extracted, project name already registered", projectName);
      return Outcome.SKIPPED;
    } catch (RuntimeException e) {
      log.warn("Could not register dependency '{}': {}", projectName, e.getMessage());
      deleteTree(target);
      return Outcome.FAILED;
    }
  }

  /**
   * Extracts {@code jar} below {@code target}.
   *
   * @throws ZipException if the jar is corrupt or an entry resolves outside {@code target}
   */
  static void extract(Path jar, Path target) throws IOException {
    Files.createDirectories(target);
    try (ZipFile zip = new ZipFile(jar.toFile())) {
      Enumeration<? extends ZipEntry> entries = zip.entries();
      while (entries.hasMoreElements()) {
        ZipEntry entry = entries.nextElement();
        Path destination = target.resolve(entry.getName()).normalize();
        if (!destination.startsWith(target)) {
          throw new ZipException("Entry '%s' escapes %s".formatted(entry.getName(), target));
        }
        if (entry.isDirectory()) {
          Files.createDirectories(destination);
          continue;
        }
        Files.createDirectories(destination.getParent());
        try (InputStream in = zip.getInputStream(entry)) {
          Files.copy(in, destination);
        }
      }
    }
  }

  private static void deleteTree(Path root) {
    if (!Files.exists(root)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(root)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      log.warn("Could not remove partial extraction {}: {}", root, e.getMessage());
    }
  }

  private enum Outcome {
    IMPORTED,
    SKIPPED,
    FAILED
  }
}
