package dev.fathom.structural;

import java.util.List;
import java.util.Optional;

/**
 * Decoded source range of an occurrence, 0-based as stored in SCIP.
 *
 * <p>SCIP encodes a range as {@code [startLine, startCharacter, endLine, endCharacter]}, or as
 * {@code [startLine, startCharacter, endCharacter]} when the range fits on one line.
 */
public record OccurrenceRange(int startLine, int startCharacter, int endLine, int endCharacter) {

  /** Decodes a raw range; any length other than 3 or 4 is malformed and yields empty. */
  public static Optional<OccurrenceRange> decode(List<Integer> raw) {
    if (raw.size() == 4) {
      return Optional.of(new OccurrenceRange(raw.get(0), raw.get(1), raw.get(2), raw.get(3)));
    }
    if (raw.size() == 3) {
      return Optional.of(new OccurrenceRange(raw.get(0), raw.get(1), raw.get(0), raw.get(2)));
    }
    return Optional.empty();
  }
}
