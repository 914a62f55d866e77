package dev.fathom.dependency;

import java.util.List;

/**
 * Project names touched by one dependency import, by outcome.
 *
 * @param imported jars extracted and registered in this run
 * @param skipped jars already extracted or already registered
 * @param failed jars that could not be read or registered; their partial trees are removed
 */
public record DependencyImportResult(
    List<String> imported, List<String> skipped, List<String> failed) {

  public DependencyImportResult {
    imported = List.copyOf(imported);
    skipped = List.copyOf(skipped);
    failed = List.copyOf(failed);
  }

  public int total() {
    return imported.size() + skipped.size() + failed.size();
  }
}
