package dev.fathom.api;

import dev.fathom.indexing.IndexRunResult;
import dev.fathom.indexing.IndexingService;
import dev.fathom.project.ProjectRegistry;
import dev.fathom.structural.StructuralIndexLocator;
import dev.fathom.structural.StructuralIndexResult;
import dev.fathom.structural.StructuralIndexer;
import jakarta.validation.Valid;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * Project management over HTTP. Index builds run on the request thread and answer when done.
 */
@RestController
@RequestMapping("/projects")
public class ProjectController {

  private final ProjectRegistry projectRegistry;
  private final IndexingService indexingService;
  private final StructuralIndexer structuralIndexer;
  private final StructuralIndexLocator structuralIndexLocator;

  public ProjectController(
      ProjectRegistry projectRegistry,
      IndexingService indexingService,
      StructuralIndexer structuralIndexer,
      StructuralIndexLocator structuralIndexLocator) {
    this.projectRegistry = projectRegistry;
    this.indexingService = indexingService;
    this.structuralIndexer = structuralIndexer;
    this.structuralIndexLocator = structuralIndexLocator;
  }

  @GetMapping
  public List<ProjectView> list() {
    return projectRegistry.list().stream()
        .map(
            project ->
                ProjectView.of(
                    project,
                    Files.isRegularFile(structuralIndexLocator.indexFor(project.getName()))))
        .toList();
  }

  @PostMapping
  public ResponseEntity<Map<String, Object>> register(
      @Valid @RequestBody RegisterProjectRequest request) {
    Path root = Path.of(request.path());
    if (!Files.isDirectory(root)) {
      throw new IllegalArgumentException(
          "'%s' does not exist or is not a directory".formatted(request.path()));
    }
    UUID id = projectRegistry.register(request.name(), root);
    URI location =
        ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{name}")
            .buildAndExpand(request.name())
            .toUri();
    Map<String, Object> body = Map.of("id", id, "name", request.name());
    return ResponseEntity.created(location).body(body);
  }

  @DeleteMapping("/{name}")
  public ResponseEntity<Void> remove(@PathVariable String name) {
    projectRegistry.remove(name);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{name}/index")
  public IndexRunResult index(
      @PathVariable String name, @RequestParam(defaultValue = "false") boolean rebuild) {
    return indexingService.runIndex(name, rebuild);
  }

  @PostMapping("/{name}/index-scip")
  public StructuralIndexResult indexStructural(@PathVariable String name) {
    return structuralIndexer.buildIndex(name);
  }
}
