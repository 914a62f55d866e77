package dev.fathom.indexing;

import dev.fathom.config.EmbeddingProperties;
import dev.fathom.extraction.Snippet;
import dev.fathom.extraction.SnippetExtractor;
import dev.fathom.extraction.SourceFileScanner;
import dev.fathom.extraction.SourceParseException;
import dev.fathom.project.ProjectRegistry;
import dev.fathom.project.ProjectRemovedEvent;
import dev.fathom.vector.CollectionHandle;
import dev.fathom.vector.SnippetRecord;
import dev.fathom.vector.SnippetVectorIndex;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Orchestrates the semantic indexing pipeline: source files -> snippets -> embeddings -> store.
 *
 * <p>Processing is best-effort per file. A file that fails to parse is logged and skipped, and
 * snippets already stored for earlier files are kept. The project's index timestamp moves only
 * when every file has been visited.
 *
 * <p>Re-indexing upserts by fingerprint, so an unchanged method is overwritten in place. Vectors of
 * methods that were deleted or moved stay in the collection until a run with {@code rebuild} set
 * drops it. Removing the project drops it too.
 */
@Service
public class IndexingService {

  private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

  private final ProjectRegistry projectRegistry;
  private final SourceFileScanner scanner;
  private final SnippetExtractor extractor;
  private final SnippetVectorIndex vectorIndex;
  private final EmbeddingModel embeddingModel;
  private final ProjectLocks projectLocks;
  private final int batchSize;

  public IndexingService(
      ProjectRegistry projectRegistry,
      SourceFileScanner scanner,
      SnippetExtractor extractor,
      SnippetVectorIndex vectorIndex,
      EmbeddingModel embeddingModel,
      ProjectLocks projectLocks,
      EmbeddingProperties embeddingProperties) {
    this.projectRegistry = projectRegistry;
    this.scanner = scanner;
    this.extractor = extractor;
    this.vectorIndex = vectorIndex;
    this.embeddingModel = embeddingModel;
    this.projectLocks = projectLocks;
    this.batchSize = embeddingProperties.getBatchSize();
  }

  /**
   * Indexes every method snippet of a registered project.
   *
   * @param projectName registered project name
   * @param rebuild drop the project's collection before indexing
   * @return run summary
   * @throws dev.fathom.project.ProjectNotFoundException if the project is not registered
   * @throws IndexingInProgressException if the project is already being indexed
   */
  public IndexRunResult runIndex(String projectName, boolean rebuild) {
    return projectLocks.runExclusive(
        projectName, IndexArtifact.SEMANTIC, () -> doRunIndex(projectName, rebuild));
  }

  /** Drops the snippet collection of a removed project. */
  @TransactionalEventListener(fallbackExecution = true)
  public void onProjectRemoved(ProjectRemovedEvent event) {
    if (vectorIndex.dropCollection(event.projectName())) {
      log.info("Dropped snippet collection of removed project '{}'", event.projectName());
    }
  }

  private IndexRunResult doRunIndex(String projectName, boolean rebuild) {
    Path root = projectRegistry.resolve(projectName);
    List<Path> files = scanner.findSourceFiles(root);
    if (files.isEmpty()) {
      log.info("No source files found for project '{}' under {}", projectName, root);
      return IndexRunResult.noSourceFiles(projectName);
    }

    if (rebuild && vectorIndex.dropCollection(projectName)) {
      log.info("Dropped existing collection of project '{}' for rebuild", projectName);
    }
    CollectionHandle handle = vectorIndex.getOrCreateCollection(projectName);
    log.info("Indexing {} source files of project '{}'", files.size(), projectName);

    int processed = 0;
    int skipped = 0;
    int snippetCount = 0;
    for (Path file : files) {
      if (Thread.currentThread().isInterrupted()) {
        log.warn(
            "Indexing of project '{}' cancelled after {} of {} files",
            projectName,
            processed + skipped,
            files.size());
        return new IndexRunResult(
            projectName, IndexRunStatus.CANCELLED, processed, skipped, snippetCount, null);
      }
      List<Snippet> snippets;
      try {
        snippets = extractor.extractFile(file);
      } catch (SourceParseException e) {
        log.warn("Skipping {}: {}", file, e.getMessage());
        skipped++;
        continue;
      }
      store(handle, snippets);
      snippetCount += snippets.size();
      processed++;
    }

    Instant indexedAt = projectRegistry.touch(projectName);
    log.info(
        "Indexed project '{}': {} files, {} skipped, {} snippets",
        projectName,
        processed,
        skipped,
        snippetCount);
    return new IndexRunResult(
        projectName, IndexRunStatus.INDEXED, processed, skipped, snippetCount, indexedAt);
  }

  private void store(CollectionHandle handle, List<Snippet> snippets) {
    for (int i = 0; i < snippets.size(); i += batchSize) {
      List<Snippet> batch = snippets.subList(i, Math.min(i + batchSize, snippets.size()));
      List<TextSegment> segments =
          batch.stream().map(s -> TextSegment.from(s.codeBody(), s.toMetadata())).toList();
      List<Embedding> embeddings = embeddingModel.embedAll(segments).content();

      List<SnippetRecord> records = new ArrayList<>(batch.size());
      for (int j = 0; j < batch.size(); j++) {
        Snippet snippet = batch.get(j);
        records.add(
            new SnippetRecord(
                snippet.fingerprint(),
                embeddings.get(j),
                snippet.codeBody(),
                segments.get(j).metadata()));
      }
      vectorIndex.upsert(handle, records);
    }
  }
}
