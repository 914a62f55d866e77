package dev.fathom.extraction;

import java.nio.file.Path;

/** Raised when a source file cannot be read or parsed. Callers recover by skipping the file. */
public class SourceParseException extends RuntimeException {

  private final Path file;

  public SourceParseException(Path file, String message) {
    super("Failed to parse %s: %s".formatted(file, message));
    this.file = file;
  }

  public SourceParseException(Path file, Throwable cause) {
    super("Failed to read %s: %s".formatted(file, cause.getMessage()), cause);
    this.file = file;
  }

  public Path getFile() {
    return file;
  }
}
