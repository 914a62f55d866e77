package dev.fathom.structural;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Finds method definitions in a project's SCIP index.
 *
 * <p>Decoded indexes are cached per path and reloaded when the file's size or modification time
 * changes, so a rebuilt index is picked up by the next query.
 */
@Service
public class StructuralSearchService {

  private static final Logger log = LoggerFactory.getLogger(StructuralSearchService.class);

  private final ScipIndexReader indexReader;
  private final Map<Path, CachedIndex> cache = new ConcurrentHashMap<>();

  public StructuralSearchService(ScipIndexReader indexReader) {
    this.indexReader = indexReader;
  }

  /**
   * Looks up the definitions of a dotted method name. Names that do not parse yield no results.
   *
   * @param indexPath SCIP index of the project
   * @param projectRoot root that the index's relative paths are resolved against
   * @param dottedQuery name such as {@code com.example.Main.greet}
   * @throws ScipIndexException if the index cannot be read
   */
  public List<StructuralMatch> search(Path indexPath, Path projectRoot, String dottedQuery) {
    SymbolQuery query;
    try {
      query = SymbolQuery.parse(dottedQuery);
    } catch (InvalidSymbolQueryException e) {
      log.warn("Ignoring structural query: {}", e.getMessage());
      return List.of();
    }
    return search(indexPath, projectRoot, query);
  }

  /**
   * Returns every definition occurrence matching {@code query}, in index order. All overloads are
   * returned; they are not ranked.
   *
   * @throws ScipIndexException if the index cannot be read
   */
  public List<StructuralMatch> search(Path indexPath, Path projectRoot, SymbolQuery query) {
    ScipIndex index = load(indexPath);
    List<StructuralMatch> matches = new ArrayList<>();
    for (ScipDocument document : index.documents()) {
      for (ScipOccurrence occurrence : document.occurrences()) {
        if (!occurrence.isDefinition() || !query.matches(occurrence.symbol())) {
          continue;
        }
        Optional<OccurrenceRange> range = OccurrenceRange.decode(occurrence.range());
        if (range.isEmpty()) {
          log.debug(
              "Skipping occurrence of {} in {} with malformed range {}",
              occurrence.symbol(),
              document.relativePath(),
              occurrence.range());
          continue;
        }
        String filePath = projectRoot.resolve(document.relativePath()).toString();
        matches.add(StructuralMatch.of(occurrence.symbol(), filePath, range.get()));
      }
    }
    log.debug("Structural query {} matched {} definitions", query.descriptorSuffix(), matches.size());
    return matches;
  }

  private ScipIndex load(Path indexPath) {
    BasicFileAttributes attributes;
    try {
      attributes = Files.readAttributes(indexPath, BasicFileAttributes.class);
    } catch (IOException e) {
      throw new ScipIndexException(indexPath, e.getMessage(), e);
    }
    CachedIndex cached = cache.get(indexPath);
    if (cached != null
        && cached.size() == attributes.size()
        && cached.modified().equals(attributes.lastModifiedTime())) {
      return cached.index();
    }
    ScipIndex index = indexReader.read(indexPath);
    cache.put(
        indexPath, new CachedIndex(attributes.size(), attributes.lastModifiedTime(), index));
    return index;
  }

  private record CachedIndex(long size, FileTime modified, ScipIndex index) {}
}
