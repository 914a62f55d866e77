package dev.fathom.structural;

/**
 * A symbol definition. Lines and characters are 1-based.
 *
 * @param symbol full SCIP symbol
 * @param filePath absolute path of the defining file
 */
public record StructuralMatch(
    String symbol,
    String filePath,
    int startLine,
    int startCharacter,
    int endLine,
    int endCharacter) {

  static StructuralMatch of(String symbol, String filePath, OccurrenceRange range) {
    return new StructuralMatch(
        symbol,
        filePath,
        range.startLine() + 1,
        range.startCharacter() + 1,
        range.endLine() + 1,
        range.endCharacter() + 1);
  }
}
