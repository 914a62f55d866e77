package dev.fathom.extraction;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/** Recursively discovers the Java source files under a project root. */
@Component
public class SourceFileScanner {

  static final String SOURCE_EXTENSION = ".java";

  /**
   * Lists every {@code .java} file below {@code root}, sorted by path so repeated runs process
   * files in the same order.
   *
   * @param root project root directory
   * @return regular source files, possibly empty
   * @throws IllegalArgumentException if {@code root} is not a directory
   */
  public List<Path> findSourceFiles(Path root) {
    if (!Files.isDirectory(root)) {
      throw new IllegalArgumentException("Root directory not found: " + root);
    }
    try (Stream<Path> paths = Files.walk(root)) {
      return paths
          .filter(Files::isRegularFile)
          .filter(path -> path.getFileName().toString().endsWith(SOURCE_EXTENSION))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to scan " + root, e);
    }
  }
}
