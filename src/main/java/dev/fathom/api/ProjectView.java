package dev.fathom.api;

import dev.fathom.project.Project;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** JSON view of a registered project. */
public record ProjectView(
    UUID id, String name, String path, @Nullable Instant lastIndexedAt, boolean structuralIndex) {

  static ProjectView of(Project project, boolean structuralIndex) {
    return new ProjectView(
        project.getId(),
        project.getName(),
        project.getPath(),
        project.getLastIndexedAt(),
        structuralIndex);
  }
}
