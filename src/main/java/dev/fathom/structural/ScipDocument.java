package dev.fathom.structural;

import java.util.List;

/**
 * Occurrences of one source file.
 *
 * @param relativePath file path relative to the project root
 * @param occurrences occurrences in index order
 */
public record ScipDocument(String relativePath, List<ScipOccurrence> occurrences) {

  public ScipDocument {
    occurrences = List.copyOf(occurrences);
  }
}
