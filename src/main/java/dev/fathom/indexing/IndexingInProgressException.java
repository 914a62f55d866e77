package dev.fathom.indexing;

import java.util.Locale;

/** Raised when an index build is requested while another build of the same artifact runs. */
public class IndexingInProgressException extends RuntimeException {

  private final String projectName;
  private final IndexArtifact artifact;

  public IndexingInProgressException(String projectName, IndexArtifact artifact) {
    super(
        "A %s index build is already running for project '%s'"
            .formatted(artifact.name().toLowerCase(Locale.ROOT), projectName));
    this.projectName = projectName;
    this.artifact = artifact;
  }

  public String getProjectName() {
    return projectName;
  }

  public IndexArtifact getArtifact() {
    return artifact;
  }
}
