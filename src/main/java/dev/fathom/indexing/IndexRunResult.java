package dev.fathom.indexing;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Summary of a semantic index run.
 *
 * @param projectName the indexed project
 * @param status terminal state of the run
 * @param filesProcessed files whose snippets were extracted and stored
 * @param filesSkipped files that failed to parse
 * @param snippetsIndexed snippets embedded and upserted
 * @param indexedAt new index timestamp, only set for {@link IndexRunStatus#INDEXED}
 */
public record IndexRunResult(
    String projectName,
    IndexRunStatus status,
    int filesProcessed,
    int filesSkipped,
    int snippetsIndexed,
    @Nullable Instant indexedAt) {

  public static IndexRunResult noSourceFiles(String projectName) {
    return new IndexRunResult(projectName, IndexRunStatus.NO_SOURCE_FILES, 0, 0, 0, null);
  }
}
