package dev.fathom.structural;

/** Raised when scip-java cannot produce an index. */
public class StructuralIndexerException extends RuntimeException {

  /** Why the build failed. */
  public enum Kind {
    /** scip-java is not installed or not on the PATH. */
    UNAVAILABLE,
    /** scip-java could not be started, failed, or produced no index file. */
    PROCESS_FAILURE,
    TIMEOUT
  }

  private final String projectName;
  private final Kind kind;

  public StructuralIndexerException(String projectName, Kind kind, String message) {
    super(message);
    this.projectName = projectName;
    this.kind = kind;
  }

  public StructuralIndexerException(
      String projectName, Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.projectName = projectName;
    this.kind = kind;
  }

  public String getProjectName() {
    return projectName;
  }

  public Kind getKind() {
    return kind;
  }
}
