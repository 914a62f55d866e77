package dev.fathom.project;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Static utility producing the canonical form of a project root path. */
public final class ProjectPaths {

  private ProjectPaths() {
    // utility class
  }

  /**
   * Returns the absolute, normalised form of {@code path}, with symbolic links resolved when the
   * path exists. Non-existent paths are made absolute and normalised only.
   *
   * @param path the path as supplied by the caller, possibly relative
   * @return the canonical path
   */
  public static Path canonicalize(Path path) {
    Path absolute = path.toAbsolutePath().normalize();
    if (!Files.exists(absolute)) {
      return absolute;
    }
    try {
      return absolute.toRealPath();
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot resolve project path " + absolute, e);
    }
  }
}
