package dev.fathom.api;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.fathom.fixture.ProjectBuilder;
import dev.fathom.indexing.IndexArtifact;
import dev.fathom.indexing.IndexRunResult;
import dev.fathom.indexing.IndexRunStatus;
import dev.fathom.indexing.IndexingInProgressException;
import dev.fathom.indexing.IndexingService;
import dev.fathom.project.ProjectAlreadyExistsException;
import dev.fathom.project.ProjectRegistry;
import dev.fathom.structural.StructuralIndexLocator;
import dev.fathom.structural.StructuralIndexer;
import dev.fathom.structural.StructuralIndexerException;
import dev.fathom.structural.StructuralProperties;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ProjectControllerTest {

  @Mock ProjectRegistry projectRegistry;

  @Mock IndexingService indexingService;

  @Mock StructuralIndexer structuralIndexer;

  @TempDir Path tempDir;

  MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    StructuralProperties properties = new StructuralProperties();
    properties.setIndexDir(tempDir.resolve("scip").toString());
    ProjectController controller =
        new ProjectController(
            projectRegistry,
            indexingService,
            structuralIndexer,
            new StructuralIndexLocator(properties));
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void listsProjects() throws Exception {
    given(projectRegistry.list())
        .willReturn(List.of(new ProjectBuilder().name("demo").path("/work/demo").build()));

    mockMvc
        .perform(get("/projects"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("demo"))
        .andExpect(jsonPath("$[0].path").value("/work/demo"))
        .andExpect(jsonPath("$[0].structuralIndex").value(false));
  }

  @Test
  void registerReturnsCreatedWithLocation() throws Exception {
    UUID id = UUID.randomUUID();
    given(projectRegistry.register("demo", tempDir)).willReturn(id);

    mockMvc
        .perform(
            post("/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"demo\", \"path\": \"%s\"}".formatted(tempDir)))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", endsWith("/projects/demo")))
        .andExpect(jsonPath("$.id").value(id.toString()));
  }

  @Test
  void registerRejectsBlankName() throws Exception {
    mockMvc
        .perform(
            post("/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"\", \"path\": \"%s\"}".formatted(tempDir)))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(projectRegistry);
  }

  @Test
  void registerRejectsMissingDirectory() throws Exception {
    mockMvc
        .perform(
            post("/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"name\": \"demo\", \"path\": \"%s\"}".formatted(tempDir.resolve("nope"))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("not a directory")));
  }

  @Test
  void duplicateNameIsConflict() throws Exception {
    given(projectRegistry.register("demo", tempDir))
        .willThrow(new ProjectAlreadyExistsException("demo"));

    mockMvc
        .perform(
            post("/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"demo\", \"path\": \"%s\"}".formatted(tempDir)))
        .andExpect(status().isConflict());
  }

  @Test
  void removeAnswersNoContent() throws Exception {
    mockMvc.perform(delete("/projects/demo")).andExpect(status().isNoContent());

    verify(projectRegistry).remove("demo");
  }

  @Test
  void indexRunsSynchronouslyWithRebuildFlag() throws Exception {
    given(indexingService.runIndex("demo", true))
        .willReturn(
            new IndexRunResult(
                "demo", IndexRunStatus.INDEXED, 2, 0, 9, Instant.parse("2026-03-01T12:00:00Z")));

    mockMvc
        .perform(post("/projects/demo/index").param("rebuild", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("INDEXED"))
        .andExpect(jsonPath("$.snippetsIndexed").value(9));
  }

  @Test
  void indexWhileRunningIsConflict() throws Exception {
    given(indexingService.runIndex("demo", false))
        .willThrow(new IndexingInProgressException("demo", IndexArtifact.SEMANTIC));

    mockMvc.perform(post("/projects/demo/index")).andExpect(status().isConflict());
  }

  @Test
  void missingScipJavaIsServiceUnavailable() throws Exception {
    given(structuralIndexer.buildIndex("demo"))
        .willThrow(
            new StructuralIndexerException(
                "demo", StructuralIndexerException.Kind.UNAVAILABLE, "scip-java not found"));

    mockMvc
        .perform(post("/projects/demo/index-scip"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.kind").value("UNAVAILABLE"));
  }
}
