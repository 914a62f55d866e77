package dev.fathom.project;

/** Thrown when registering a name that is already taken. The registry is left unchanged. */
public class ProjectAlreadyExistsException extends RuntimeException {

  private final String projectName;

  public ProjectAlreadyExistsException(String projectName) {
    super("Project with name '%s' already exists".formatted(projectName));
    this.projectName = projectName;
  }

  public ProjectAlreadyExistsException(String projectName, Throwable cause) {
    super("Project with name '%s' already exists".formatted(projectName), cause);
    this.projectName = projectName;
  }

  public String getProjectName() {
    return projectName;
  }
}
