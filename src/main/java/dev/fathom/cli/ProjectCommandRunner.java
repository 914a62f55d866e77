package dev.fathom.cli;

import dev.fathom.dependency.DependencyImportResult;
import dev.fathom.dependency.DependencySourceImporter;
import dev.fathom.indexing.IndexRunResult;
import dev.fathom.indexing.IndexingInProgressException;
import dev.fathom.indexing.IndexingService;
import dev.fathom.project.Project;
import dev.fathom.project.ProjectAlreadyExistsException;
import dev.fathom.project.ProjectNotFoundException;
import dev.fathom.project.ProjectRegistry;
import dev.fathom.structural.StructuralIndexResult;
import dev.fathom.structural.StructuralIndexer;
import dev.fathom.structural.StructuralIndexerException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * One-shot project management commands, active under the {@code cli} profile.
 *
 * <pre>
 * add &lt;name&gt; &lt;path&gt;
 * remove &lt;name&gt;
 * list
 * index &lt;name&gt; [--rebuild]
 * index-scip &lt;name&gt;
 * import-deps
 * </pre>
 *
 * <p>Exit code 0 on success, 1 when the command failed, 2 on a usage error.
 */
@Component
@Profile("cli")
public class ProjectCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  static final String USAGE =
      """
      Usage:
        add <name> <path>          register a project directory
        remove <name>              unregister a project
        list                       list registered projects
        index <name> [--rebuild]   build the semantic index
        index-scip <name>          build the structural (SCIP) index
        import-deps                extract and register Maven source jars""";

  private final ProjectRegistry projectRegistry;
  private final IndexingService indexingService;
  private final StructuralIndexer structuralIndexer;
  private final DependencySourceImporter dependencyImporter;
  private final PrintStream out;
  private final PrintStream err;
  private int exitCode = EXIT_OK;

  @Autowired
  public ProjectCommandRunner(
      ProjectRegistry projectRegistry,
      IndexingService indexingService,
      StructuralIndexer structuralIndexer,
      DependencySourceImporter dependencyImporter) {
    this(
        projectRegistry,
        indexingService,
        structuralIndexer,
        dependencyImporter,
        System.out,
        System.err);
  }

  ProjectCommandRunner(
      ProjectRegistry projectRegistry,
      IndexingService indexingService,
      StructuralIndexer structuralIndexer,
      DependencySourceImporter dependencyImporter,
      PrintStream out,
      PrintStream err) {
    this.projectRegistry = projectRegistry;
    this.indexingService = indexingService;
    this.structuralIndexer = structuralIndexer;
    this.dependencyImporter = dependencyImporter;
    this.out = out;
    this.err = err;
  }

  @Override
  public void run(ApplicationArguments args) {
    exitCode = execute(args.getNonOptionArgs(), args.containsOption("rebuild"));
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  int execute(List<String> arguments, boolean rebuild) {
    if (arguments.isEmpty()) {
      err.println(USAGE);
      return EXIT_USAGE;
    }
    String command = arguments.get(0);
    List<String> operands = arguments.subList(1, arguments.size());
    try {
      return switch (command) {
        case "add" -> operands.size() == 2 ? add(operands.get(0), operands.get(1)) : usage();
        case "remove" -> operands.size() == 1 ? remove(operands.get(0)) : usage();
        case "list" -> operands.isEmpty() ? list() : usage();
        case "index" -> operands.size() == 1 ? index(operands.get(0), rebuild) : usage();
        case "index-scip" -> operands.size() == 1 ? indexStructural(operands.get(0)) : usage();
        case "import-deps" -> operands.isEmpty() ? importDependencies() : usage();
        default -> {
          err.println("Unknown command: " + command);
          yield usage();
        }
      };
    } catch (ProjectNotFoundException
        | ProjectAlreadyExistsException
        | IndexingInProgressException
        | StructuralIndexerException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private int add(String name, String path) {
    Path root = Path.of(path);
    if (!Files.exists(root)) {
      err.println("Error: path '%s' does not exist".formatted(path));
      return EXIT_FAILURE;
    }
    if (!Files.isDirectory(root)) {
      err.println("Error: path '%s' is not a directory".formatted(path));
      return EXIT_FAILURE;
    }
    projectRegistry.register(name, root);
    out.println("Project '%s' added at %s".formatted(name, projectRegistry.resolve(name)));
    return EXIT_OK;
  }

  private int remove(String name) {
    if (projectRegistry.remove(name)) {
      out.println("Project '%s' removed".formatted(name));
    } else {
      out.println("Project '%s' was not registered".formatted(name));
    }
    return EXIT_OK;
  }

  private int list() {
    List<Project> projects = projectRegistry.list();
    if (projects.isEmpty()) {
      out.println("No projects registered.");
      return EXIT_OK;
    }
    for (Project project : projects) {
      out.println(
          "%-24s %s  (last indexed: %s)"
              .formatted(
                  project.getName(),
                  project.getPath(),
                  project.getLastIndexedAt() != null ? project.getLastIndexedAt() : "never"));
    }
    return EXIT_OK;
  }

  private int index(String name, boolean rebuild) {
    IndexRunResult result = indexingService.runIndex(name, rebuild);
    switch (result.status()) {
      case INDEXED -> out.println(
          "Indexed '%s': %d snippets from %d files (%d skipped)"
              .formatted(
                  name, result.snippetsIndexed(), result.filesProcessed(), result.filesSkipped()));
      case NO_SOURCE_FILES -> out.println("No source files found in project '%s'".formatted(name));
      case CANCELLED -> {
        err.println("Indexing of '%s' was cancelled".formatted(name));
        return EXIT_FAILURE;
      }
    }
    return EXIT_OK;
  }

  private int indexStructural(String name) {
    StructuralIndexResult result = structuralIndexer.buildIndex(name);
    out.println(
        "Structural index of '%s' written to %s in %ds"
            .formatted(name, result.indexPath(), result.elapsed().toSeconds()));
    return EXIT_OK;
  }

  private int importDependencies() {
    DependencyImportResult result;
    try {
      result = dependencyImporter.importAll();
    } catch (UncheckedIOException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_FAILURE;
    }
    if (result.total() == 0) {
      out.println("No source jars found.");
      return EXIT_OK;
    }
    result.imported().forEach(name -> out.println("Imported " + name));
    result.failed().forEach(name -> err.println("Could not import " + name));
    out.println(
        "%d imported, %d already present, %d failed"
            .formatted(result.imported().size(), result.skipped().size(), result.failed().size()));
    return EXIT_OK;
  }

  private int usage() {
    err.println(USAGE);
    return EXIT_USAGE;
  }
}
