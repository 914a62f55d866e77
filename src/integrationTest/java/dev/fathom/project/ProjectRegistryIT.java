package dev.fathom.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.fathom.BaseIntegrationTest;
import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;

/** Exercises the registry against the Flyway schema; JPA runs with ddl-auto=none. */
class ProjectRegistryIT extends BaseIntegrationTest {

  @Autowired ProjectRegistry projectRegistry;

  @TempDir Path tempDir;

  @Test
  void registeredProjectRoundTripsWithCanonicalPath() throws Exception {
    UUID id = projectRegistry.register("demo", tempDir.resolve("."));

    Project found = projectRegistry.get("demo");

    assertThat(found.getId()).isEqualTo(id);
    assertThat(found.getPath()).isEqualTo(tempDir.toRealPath().toString());
    assertThat(found.getLastIndexedAt()).isNull();
  }

  @Test
  void duplicateNameIsRejected() {
    projectRegistry.register("demo", tempDir);

    assertThatThrownBy(() -> projectRegistry.register("demo", tempDir))
        .isInstanceOf(ProjectAlreadyExistsException.class);
  }

  @Test
  void touchPersistsIndexTimestamp() {
    projectRegistry.register("demo", tempDir);

    Instant touched = projectRegistry.touch("demo");

    Instant stored = projectRegistry.get("demo").getLastIndexedAt();
    assertThat(stored).isNotNull();
    assertThat(stored.toEpochMilli()).isEqualTo(touched.toEpochMilli());
  }

  @Test
  void listIsOrderedByName() {
    projectRegistry.register("zeta", tempDir);
    projectRegistry.register("alpha", tempDir);

    assertThat(projectRegistry.list()).extracting(Project::getName).containsExactly("alpha", "zeta");
  }

  @Test
  void removeDeletesAndIsIdempotent() {
    projectRegistry.register("demo", tempDir);

    assertThat(projectRegistry.remove("demo")).isTrue();
    assertThat(projectRegistry.remove("demo")).isFalse();
    assertThat(projectRegistry.find("demo")).isEmpty();
    assertThatThrownBy(() -> projectRegistry.resolve("demo"))
        .isInstanceOf(ProjectNotFoundException.class);
  }
}
