package dev.fathom.project;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectPathsTest {

  @TempDir Path tempDir;

  @Test
  void existingPathIsResolvedToRealPath() throws Exception {
    Path nested = Files.createDirectories(tempDir.resolve("a/b"));

    Path result = ProjectPaths.canonicalize(nested.resolve("../b/."));

    assertThat(result).isEqualTo(nested.toRealPath());
  }

  @Test
  void symbolicLinkIsFollowed() throws Exception {
    Path target = Files.createDirectories(tempDir.resolve("target"));
    Path link = Files.createSymbolicLink(tempDir.resolve("link"), target);

    assertThat(ProjectPaths.canonicalize(link)).isEqualTo(target.toRealPath());
  }

  @Test
  void missingPathIsOnlyNormalised() {
    Path missing = tempDir.resolve("missing/../other");

    Path result = ProjectPaths.canonicalize(missing);

    assertThat(result).isAbsolute();
    assertThat(result).isEqualTo(tempDir.resolve("other").toAbsolutePath().normalize());
  }
}
