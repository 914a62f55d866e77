package dev.fathom.project;

/** Thrown when a project name is not registered. */
public class ProjectNotFoundException extends RuntimeException {

  private final String projectName;

  public ProjectNotFoundException(String projectName) {
    super("Project '%s' not found".formatted(projectName));
    this.projectName = projectName;
  }

  public String getProjectName() {
    return projectName;
  }
}
