package dev.fathom.mcp;

import dev.fathom.dependency.DependencyImportResult;
import dev.fathom.dependency.DependencySourceImporter;
import dev.fathom.indexing.IndexArtifact;
import dev.fathom.indexing.IndexRunResult;
import dev.fathom.indexing.IndexingInProgressException;
import dev.fathom.indexing.IndexingService;
import dev.fathom.indexing.ProjectLocks;
import dev.fathom.project.Project;
import dev.fathom.project.ProjectNotFoundException;
import dev.fathom.project.ProjectRegistry;
import dev.fathom.search.SearchProperties;
import dev.fathom.search.SearchQuery;
import dev.fathom.search.SearchResponse;
import dev.fathom.search.SearchRouter;
import dev.fathom.search.SearchType;
import dev.fathom.structural.StructuralIndexLocator;
import dev.fathom.structural.StructuralIndexResult;
import dev.fathom.structural.StructuralIndexer;
import dev.fathom.structural.StructuralIndexerException;
import jakarta.annotation.PreDestroy;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing code search and project management as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Index builds can take minutes, so {@code index_project} and {@code index_structural} start
 * the build in the background and return at once; {@code index_status} reports progress and how
 * the last build of each artifact ended, including the failure kind when it failed.
 *
 * @see TokenBudgetTruncator
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final SearchRouter searchRouter;
  private final ProjectRegistry projectRegistry;
  private final IndexingService indexingService;
  private final StructuralIndexer structuralIndexer;
  private final StructuralIndexLocator structuralIndexLocator;
  private final DependencySourceImporter dependencyImporter;
  private final ProjectLocks projectLocks;
  private final SearchProperties searchProperties;
  private final TokenBudgetTruncator truncator;
  private final ExecutorService indexExecutor = Executors.newSingleThreadExecutor();
  private final Map<String, BuildOutcome> lastOutcomes = new ConcurrentHashMap<>();

  public McpToolService(
      SearchRouter searchRouter,
      ProjectRegistry projectRegistry,
      IndexingService indexingService,
      StructuralIndexer structuralIndexer,
      StructuralIndexLocator structuralIndexLocator,
      DependencySourceImporter dependencyImporter,
      ProjectLocks projectLocks,
      SearchProperties searchProperties,
      TokenBudgetTruncator truncator) {
    this.searchRouter = searchRouter;
    this.projectRegistry = projectRegistry;
    this.indexingService = indexingService;
    this.structuralIndexer = structuralIndexer;
    this.structuralIndexLocator = structuralIndexLocator;
    this.dependencyImporter = dependencyImporter;
    this.projectLocks = projectLocks;
    this.searchProperties = searchProperties;
    this.truncator = truncator;
  }

  /** Searches a registered project with token budget enforcement. */
  @Tool(
      name = "search_code",
      description =
          "Search a registered code project. search_type 'semantic' finds methods similar to a "
              + "natural-language description, 'literal' finds lines containing the exact text, "
              + "'structural' finds the definition of a method given as package.Type.method.")
  public String searchCode(
      @ToolParam(description = "Registered project name") @Nullable String projectName,
      @ToolParam(description = "Query text, literal pattern or dotted method name")
          @Nullable String query,
      @ToolParam(description = "One of: semantic, literal, structural") @Nullable String searchType,
      @ToolParam(description = "Maximum number of semantic results (1-50, default 5)",
              required = false)
          @Nullable Integer maxResults) {
    try {
      if (projectName == null || projectName.isBlank()) {
        return "Error: Project name must not be empty. Use list_projects to see registered projects.";
      }
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      if (searchType == null || searchType.isBlank()) {
        return "Error: search_type is required. Use one of: semantic, literal, structural.";
      }
      SearchType type = SearchType.fromString(searchType);
      SearchResponse response =
          searchRouter.route(
              new SearchQuery(projectName, query, type, searchProperties.clampTopK(maxResults)));

      if (response.results().isEmpty()) {
        return SearchResponse.SUCCESS.equals(response.message())
            ? "No results found for %s query: %s".formatted(type.wireName(), query)
            : response.message();
      }
      return truncator.truncate(response.results());
    } catch (ProjectNotFoundException e) {
      return "Error: Project '%s' not found. Use list_projects to see registered projects."
          .formatted(e.getProjectName());
    } catch (Exception e) {
      return "Error searching code: " + e.getMessage();
    }
  }

  /** Lists registered projects with their index state. */
  @Tool(
      name = "list_projects",
      description = "List registered code projects with root path and last semantic index time.")
  public String listProjects() {
    try {
      List<Project> projects = projectRegistry.list();
      if (projects.isEmpty()) {
        return "No projects registered. Use add_project to add one.";
      }
      StringBuilder sb = new StringBuilder();
      for (Project project : projects) {
        sb.append(
            String.format(
                "- %s: %s | last indexed: %s | structural index: %s%n",
                project.getName(),
                project.getPath(),
                project.getLastIndexedAt() != null
                    ? project.getLastIndexedAt().toString()
                    : "never",
                hasStructuralIndex(project.getName()) ? "yes" : "no"));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error listing projects: " + e.getMessage();
    }
  }

  /** Registers a project directory under a new name. */
  @Tool(
      name = "add_project",
      description = "Register a source directory under a unique project name.")
  public String addProject(
      @ToolParam(description = "Unique project name") @Nullable String name,
      @ToolParam(description = "Absolute path of the project root directory") @Nullable String path) {
    try {
      if (name == null || name.isBlank()) {
        return "Error: Project name must not be empty.";
      }
      if (path == null || path.isBlank()) {
        return "Error: Path must not be empty. Provide the project root directory.";
      }
      Path root = Path.of(path);
      if (!Files.isDirectory(root)) {
        return "Error: '%s' does not exist or is not a directory.".formatted(path);
      }
      UUID id = projectRegistry.register(name, root);
      return "Project '%s' registered (ID: %s). Index it with index_project.".formatted(name, id);
    } catch (InvalidPathException e) {
      return "Error: Invalid path: " + e.getMessage();
    } catch (Exception e) {
      return "Error adding project: " + e.getMessage();
    }
  }

  /** Unregisters a project. */
  @Tool(
      name = "remove_project",
      description = "Unregister a project and delete its semantic and structural indexes.")
  public String removeProject(@ToolParam(description = "Project name") String name) {
    try {
      return projectRegistry.remove(name)
          ? "Project '%s' removed.".formatted(name)
          : "Project '%s' was not registered; nothing to remove.".formatted(name);
    } catch (Exception e) {
      return "Error removing project: " + e.getMessage();
    }
  }

  /** Extracts the source jars of the local Maven repository and registers each as a project. */
  @Tool(
      name = "import_dependencies",
      description =
          "Extract every *-sources.jar of the local Maven repository and register each one as a "
              + "project named dep_<artifact>-<version>. Already extracted jars are skipped.")
  public String importDependencies() {
    try {
      DependencyImportResult result = dependencyImporter.importAll();
      if (result.total() == 0) {
        return "No source jars found in the local Maven repository.";
      }
      StringBuilder sb =
          new StringBuilder(
              "%d imported, %d already present, %d failed%n"
                  .formatted(
                      result.imported().size(), result.skipped().size(), result.failed().size()));
      result.imported().forEach(name -> sb.append("- imported ").append(name).append('\n'));
      result.failed().forEach(name -> sb.append("- failed ").append(name).append('\n'));
      if (!result.imported().isEmpty()) {
        sb.append("Index the new projects with index_project.");
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error importing dependencies: " + e.getMessage();
    }
  }

  /** Starts a semantic index build in the background. */
  @Tool(
      name = "index_project",
      description =
          "Build or refresh the semantic index of a project in the background. "
              + "Use rebuild=true to drop vectors of deleted or moved methods.")
  public String indexProject(
      @ToolParam(description = "Project name") String name,
      @ToolParam(description = "Drop the existing semantic index first", required = false)
          @Nullable Boolean rebuild) {
    try {
      projectRegistry.get(name);
      if (projectLocks.isLocked(name, IndexArtifact.SEMANTIC)) {
        return "Error: Project '%s' is already being indexed. Check progress with index_status."
            .formatted(name);
      }
      boolean fullRebuild = Boolean.TRUE.equals(rebuild);
      dispatch(
          trackedBuild(
              name,
              IndexArtifact.SEMANTIC,
              () -> {
                IndexRunResult result = indexingService.runIndex(name, fullRebuild);
                return "%s, %d snippets indexed, %d files skipped"
                    .formatted(result.status(), result.snippetsIndexed(), result.filesSkipped());
              }),
          name);
      return "Semantic indexing of '%s' started (%s). Check progress with index_status."
          .formatted(name, fullRebuild ? "full rebuild" : "incremental");
    } catch (ProjectNotFoundException e) {
      return "Error: Project '%s' not found.".formatted(name);
    } catch (Exception e) {
      return "Error starting indexing: " + e.getMessage();
    }
  }

  /** Starts a structural (SCIP) index build in the background. */
  @Tool(
      name = "index_structural",
      description =
          "Build the structural (SCIP) index of a project with scip-java in the background. "
              + "Required before structural searches.")
  public String indexStructural(@ToolParam(description = "Project name") String name) {
    try {
      projectRegistry.get(name);
      if (projectLocks.isLocked(name, IndexArtifact.STRUCTURAL)) {
        return "Error: A structural index build for '%s' is already running.".formatted(name);
      }
      dispatch(
          trackedBuild(
              name,
              IndexArtifact.STRUCTURAL,
              () -> {
                StructuralIndexResult result = structuralIndexer.buildIndex(name);
                return "index written to %s in %s".formatted(result.indexPath(), result.elapsed());
              }),
          name);
      return "Structural indexing of '%s' started. Check progress with index_status."
          .formatted(name);
    } catch (ProjectNotFoundException e) {
      return "Error: Project '%s' not found.".formatted(name);
    } catch (Exception e) {
      return "Error starting structural indexing: " + e.getMessage();
    }
  }

  /** Reports whether index builds are running and when the project was last indexed. */
  @Tool(
      name = "index_status",
      description = "Show the semantic and structural index state of a project.")
  public String indexStatus(@ToolParam(description = "Project name") String name) {
    try {
      Project project = projectRegistry.get(name);
      return """
          Project: %s (%s)
          Semantic index: %s%s
          Structural index: %s%s"""
          .formatted(
              project.getName(),
              project.getPath(),
              projectLocks.isLocked(name, IndexArtifact.SEMANTIC)
                  ? "indexing in progress"
                  : project.getLastIndexedAt() != null
                      ? "last indexed " + project.getLastIndexedAt()
                      : "never indexed",
              outcomeSuffix(name, IndexArtifact.SEMANTIC),
              projectLocks.isLocked(name, IndexArtifact.STRUCTURAL)
                  ? "build in progress"
                  : hasStructuralIndex(name) ? "available" : "missing",
              outcomeSuffix(name, IndexArtifact.STRUCTURAL));
    } catch (ProjectNotFoundException e) {
      return "Error: Project '%s' not found.".formatted(name);
    } catch (Exception e) {
      return "Error checking index status: " + e.getMessage();
    }
  }

  /**
   * Wraps a build so its outcome is kept for {@code index_status}. The wrapped build never throws;
   * a failure is logged and recorded with its kind and message.
   */
  Runnable trackedBuild(String projectName, IndexArtifact artifact, Supplier<String> build) {
    return () -> {
      String key = outcomeKey(projectName, artifact);
      try {
        String summary = build.get();
        lastOutcomes.put(key, BuildOutcome.success(summary));
        log.info("Background {} build of '{}' finished: {}", artifact, projectName, summary);
      } catch (Exception e) {
        lastOutcomes.put(key, BuildOutcome.failure(describeFailure(e)));
        log.error(
            "Background {} build failed for project '{}': {}",
            artifact,
            projectName,
            e.getMessage(),
            e);
      }
    };
  }

  /** Runs an index build off the calling thread. Extracted for testability. */
  void dispatch(Runnable build, String projectName) {
    indexExecutor.execute(
        () -> {
          try {
            build.run();
          } catch (Exception e) {
            log.error("Background index build failed for project '{}': {}", projectName,
                e.getMessage(), e);
          }
        });
  }

  @PreDestroy
  void shutdown() {
    indexExecutor.shutdownNow();
  }

  private String outcomeSuffix(String projectName, IndexArtifact artifact) {
    BuildOutcome outcome = lastOutcomes.get(outcomeKey(projectName, artifact));
    return outcome == null ? "" : " | " + outcome.describe();
  }

  private static String outcomeKey(String projectName, IndexArtifact artifact) {
    return projectName + "/" + artifact;
  }

  private static String describeFailure(Exception e) {
    if (e instanceof StructuralIndexerException indexerFailure) {
      return "(%s) %s".formatted(indexerFailure.getKind(), indexerFailure.getMessage());
    }
    if (e instanceof IndexingInProgressException) {
      return "(IN_PROGRESS) " + e.getMessage();
    }
    return "(%s) %s".formatted(e.getClass().getSimpleName(), e.getMessage());
  }

  private boolean hasStructuralIndex(String projectName) {
    return Files.isRegularFile(structuralIndexLocator.indexFor(projectName));
  }
}
