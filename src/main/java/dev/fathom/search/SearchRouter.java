package dev.fathom.search;

import dev.fathom.literal.LiteralMatch;
import dev.fathom.literal.LiteralSearchOutcome;
import dev.fathom.literal.RipgrepSearchService;
import dev.fathom.project.Project;
import dev.fathom.project.ProjectNotFoundException;
import dev.fathom.project.ProjectRegistry;
import dev.fathom.structural.InvalidSymbolQueryException;
import dev.fathom.structural.StructuralIndexLocator;
import dev.fathom.structural.StructuralMatch;
import dev.fathom.structural.StructuralSearchService;
import dev.fathom.structural.SymbolQuery;
import dev.fathom.vector.SemanticMatch;
import dev.fathom.vector.SemanticQueryResult;
import dev.fathom.vector.SnippetVectorIndex;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Dispatches a {@link SearchQuery} to the backend of its modality.
 *
 * <p>The project is resolved once; an unknown name raises {@link ProjectNotFoundException}. Missing
 * per-project artifacts (no semantic collection, no SCIP index) and unusable structural queries
 * are not errors: they produce an empty result with an explanatory message. Every backend failure
 * surfaces as {@link SearchBackendException}.
 */
@Service
public class SearchRouter {

  private static final Logger log = LoggerFactory.getLogger(SearchRouter.class);

  private final ProjectRegistry projectRegistry;
  private final SnippetVectorIndex vectorIndex;
  private final RipgrepSearchService ripgrepSearchService;
  private final StructuralSearchService structuralSearchService;
  private final StructuralIndexLocator structuralIndexLocator;
  private final SearchProperties searchProperties;

  public SearchRouter(
      ProjectRegistry projectRegistry,
      SnippetVectorIndex vectorIndex,
      RipgrepSearchService ripgrepSearchService,
      StructuralSearchService structuralSearchService,
      StructuralIndexLocator structuralIndexLocator,
      SearchProperties searchProperties) {
    this.projectRegistry = projectRegistry;
    this.vectorIndex = vectorIndex;
    this.ripgrepSearchService = ripgrepSearchService;
    this.structuralSearchService = structuralSearchService;
    this.structuralIndexLocator = structuralIndexLocator;
    this.searchProperties = searchProperties;
  }

  /**
   * Runs a query against its project.
   *
   * @throws ProjectNotFoundException if the project is not registered
   * @throws SearchBackendException if the backend fails
   */
  public SearchResponse route(SearchQuery query) {
    Project project = projectRegistry.get(query.projectName());
    log.debug(
        "Routing {} query on project '{}': {}",
        query.searchType().wireName(),
        project.getName(),
        query.query());
    try {
      return switch (query.searchType()) {
        case SEMANTIC -> semantic(project, query);
        case LITERAL -> literal(project, query);
        case STRUCTURAL -> structural(project, query);
      };
    } catch (SearchBackendException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error(
          "{} search on project '{}' failed", query.searchType().wireName(), project.getName(), e);
      throw new SearchBackendException(
          query.searchType(), BackendErrorKind.INTERNAL, e.getMessage(), e);
    }
  }

  private SearchResponse semantic(Project project, SearchQuery query) {
    int topK = Math.min(query.topK(), searchProperties.getMaxTopK());
    SemanticQueryResult result = vectorIndex.query(project.getName(), query.query(), topK);
    if (result instanceof SemanticQueryResult.CollectionNotFound) {
      return SearchResponse.empty(
          SearchType.SEMANTIC,
          "Project '%s' has no semantic index yet. Run 'index %s' first."
              .formatted(project.getName(), project.getName()));
    }
    List<SemanticMatch> matches = ((SemanticQueryResult.Found) result).matches();
    return SearchResponse.success(
        SearchType.SEMANTIC,
        matches.stream()
            .map(
                match ->
                    new SearchHit.SemanticHit(match.document(), match.metadata(), match.distance()))
            .toList());
  }

  private SearchResponse literal(Project project, SearchQuery query) {
    LiteralSearchOutcome outcome = ripgrepSearchService.search(project.getRoot(), query.query());
    if (outcome instanceof LiteralSearchOutcome.Success success) {
      return SearchResponse.success(
          SearchType.LITERAL, success.matches().stream().map(SearchRouter::literalHit).toList());
    }
    if (outcome instanceof LiteralSearchOutcome.NoMatches) {
      return SearchResponse.success(SearchType.LITERAL, List.of());
    }
    if (outcome instanceof LiteralSearchOutcome.ToolMissing missing) {
      throw new SearchBackendException(
          SearchType.LITERAL,
          BackendErrorKind.UNAVAILABLE,
          "Literal search tool '%s' not found. Is ripgrep installed and on the PATH?"
              .formatted(missing.executable()));
    }
    if (outcome instanceof LiteralSearchOutcome.StartFailed startFailed) {
      throw new SearchBackendException(
          SearchType.LITERAL,
          BackendErrorKind.PROCESS_FAILURE,
          "Could not start '%s': %s".formatted(startFailed.executable(), startFailed.message()));
    }
    if (outcome instanceof LiteralSearchOutcome.ToolError error) {
      throw new SearchBackendException(
          SearchType.LITERAL,
          BackendErrorKind.PROCESS_FAILURE,
          "ripgrep exited with %d: %s".formatted(error.exitCode(), error.stderr().strip()));
    }
    LiteralSearchOutcome.TimedOut timedOut = (LiteralSearchOutcome.TimedOut) outcome;
    throw new SearchBackendException(
        SearchType.LITERAL,
        BackendErrorKind.TIMEOUT,
        "Literal search timed out after " + timedOut.timeout());
  }

  private SearchResponse structural(Project project, SearchQuery query) {
    Path indexPath = structuralIndexLocator.indexFor(project.getName());
    if (!Files.isRegularFile(indexPath)) {
      return SearchResponse.empty(
          SearchType.STRUCTURAL,
          "Project '%s' has no structural index. Run 'index-scip %s' first."
              .formatted(project.getName(), project.getName()));
    }
    SymbolQuery symbolQuery;
    try {
      symbolQuery = SymbolQuery.parse(query.query());
    } catch (InvalidSymbolQueryException e) {
      return SearchResponse.empty(SearchType.STRUCTURAL, e.getMessage());
    }
    List<StructuralMatch> matches =
        structuralSearchService.search(indexPath, project.getRoot(), symbolQuery);
    return SearchResponse.success(
        SearchType.STRUCTURAL, matches.stream().map(SearchRouter::structuralHit).toList());
  }

  private static SearchHit literalHit(LiteralMatch match) {
    return new SearchHit.LiteralHit(
        match.filePath(),
        match.lineNumber(),
        match.matchText(),
        match.absoluteOffset(),
        match.submatches());
  }

  private static SearchHit structuralHit(StructuralMatch match) {
    return new SearchHit.StructuralHit(
        match.symbol(),
        match.filePath(),
        match.startLine(),
        match.startCharacter(),
        match.endLine(),
        match.endCharacter());
  }
}
