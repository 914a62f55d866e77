package dev.fathom.literal;

import java.util.List;

/**
 * A line containing the searched pattern.
 *
 * @param filePath path of the file as reported by ripgrep
 * @param lineNumber 1-based line number
 * @param matchText the whole line, trimmed
 * @param absoluteOffset byte offset of the line start within the file
 * @param submatches occurrences of the pattern within the line
 */
public record LiteralMatch(
    String filePath,
    int lineNumber,
    String matchText,
    long absoluteOffset,
    List<Submatch> submatches) {

  public LiteralMatch {
    submatches = List.copyOf(submatches);
  }
}
