package dev.fathom.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.fathom.fixture.ProjectBuilder;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class ProjectRegistryTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock ProjectRepository projectRepository;
  @Mock ApplicationEventPublisher eventPublisher;

  @Captor ArgumentCaptor<Project> projectCaptor;

  @TempDir Path tempDir;

  ProjectRegistry registry;

  @BeforeEach
  void setUp() {
    registry =
        new ProjectRegistry(projectRepository, Clock.fixed(NOW, ZoneOffset.UTC), eventPublisher);
  }

  @Test
  void registerStoresCanonicalPathAndReturnsId() throws Exception {
    UUID id = UUID.randomUUID();
    given(projectRepository.existsByName("demo")).willReturn(false);
    given(projectRepository.saveAndFlush(any(Project.class)))
        .willReturn(new ProjectBuilder().id(id).name("demo").build());

    UUID result = registry.register("demo", tempDir.resolve("sub/..").resolve("."));

    assertThat(result).isEqualTo(id);
    verify(projectRepository).saveAndFlush(projectCaptor.capture());
    assertThat(projectCaptor.getValue().getName()).isEqualTo("demo");
    assertThat(projectCaptor.getValue().getPath()).isEqualTo(tempDir.toRealPath().toString());
    assertThat(projectCaptor.getValue().getLastIndexedAt()).isNull();
  }

  @Test
  void registerDuplicateNameFailsWithoutSaving() {
    given(projectRepository.existsByName("demo")).willReturn(true);

    assertThatThrownBy(() -> registry.register("demo", tempDir))
        .isInstanceOf(ProjectAlreadyExistsException.class)
        .hasMessageContaining("demo");
    verify(projectRepository, never()).saveAndFlush(any());
  }

  @Test
  void registerTranslatesConcurrentUniqueViolationToDuplicate() {
    given(projectRepository.existsByName("demo")).willReturn(false);
    given(projectRepository.saveAndFlush(any(Project.class)))
        .willThrow(new DataIntegrityViolationException("uk_projects_name"));

    assertThatThrownBy(() -> registry.register("demo", tempDir))
        .isInstanceOf(ProjectAlreadyExistsException.class)
        .hasCauseInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void registerRejectsBlankName() {
    assertThatThrownBy(() -> registry.register("  ", tempDir))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void resolveReturnsStoredRoot() {
    given(projectRepository.findByName("demo"))
        .willReturn(Optional.of(new ProjectBuilder().name("demo").path("/work/demo").build()));

    assertThat(registry.resolve("demo")).isEqualTo(Path.of("/work/demo"));
  }

  @Test
  void resolveUnknownNameFailsWithNotFound() {
    given(projectRepository.findByName("ghost")).willReturn(Optional.empty());

    assertThatThrownBy(() -> registry.resolve("ghost"))
        .isInstanceOf(ProjectNotFoundException.class)
        .hasMessageContaining("ghost");
  }

  @Test
  void listDelegatesToNameOrderedQuery() {
    List<Project> projects =
        List.of(new ProjectBuilder().name("alpha").build(), new ProjectBuilder().name("beta").build());
    given(projectRepository.findAllByOrderByNameAsc()).willReturn(projects);

    assertThat(registry.list()).extracting(Project::getName).containsExactly("alpha", "beta");
  }

  @Test
  void touchSetsLastIndexedAtFromClock() {
    Project project = new ProjectBuilder().name("demo").build();
    given(projectRepository.findByName("demo")).willReturn(Optional.of(project));

    Instant touched = registry.touch("demo");

    assertThat(touched).isEqualTo(NOW);
    assertThat(project.getLastIndexedAt()).isEqualTo(NOW);
    verify(projectRepository).save(project);
  }

  @Test
  void touchUnknownNameFailsWithNotFound() {
    given(projectRepository.findByName("ghost")).willReturn(Optional.empty());

    assertThatThrownBy(() -> registry.touch("ghost")).isInstanceOf(ProjectNotFoundException.class);
  }

  @Test
  void removeDeletesExistingProject() {
    Project project = new ProjectBuilder().name("demo").build();
    given(projectRepository.findByName("demo")).willReturn(Optional.of(project));

    assertThat(registry.remove("demo")).isTrue();
    verify(projectRepository).delete(project);
    verify(eventPublisher).publishEvent(new ProjectRemovedEvent("demo"));
  }

  @Test
  void removeUnknownNameIsNoOp() {
    given(projectRepository.findByName("ghost")).willReturn(Optional.empty());

    assertThat(registry.remove("ghost")).isFalse();
    verify(projectRepository, never()).delete(any());
    verifyNoInteractions(eventPublisher);
  }
}
