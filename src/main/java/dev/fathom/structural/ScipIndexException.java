package dev.fathom.structural;

import java.nio.file.Path;

/** Raised when a SCIP index file cannot be read or is not a SCIP index. */
public class ScipIndexException extends RuntimeException {

  private final Path indexPath;

  public ScipIndexException(Path indexPath, String message, Throwable cause) {
    super("Cannot read SCIP index %s: %s".formatted(indexPath, message), cause);
    this.indexPath = indexPath;
  }

  public Path getIndexPath() {
    return indexPath;
  }
}
