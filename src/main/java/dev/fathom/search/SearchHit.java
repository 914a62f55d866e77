package dev.fathom.search;

import dev.fathom.literal.Submatch;
import java.util.List;
import java.util.Map;

/** One search result. The concrete type depends on the modality that produced it. */
public sealed interface SearchHit {

  /**
   * A snippet close to the query in embedding space.
   *
   * @param document the snippet's code body
   * @param metadata snippet location fields (file_path, class_name, method_name, ...)
   * @param distance cosine distance {@code 1 - cos}, from 0 to 2, lower is closer
   */
  record SemanticHit(String document, Map<String, Object> metadata, double distance)
      implements SearchHit {
    public SemanticHit {
      metadata = Map.copyOf(metadata);
    }
  }

  record LiteralHit(
      String filePath,
      int lineNumber,
      String matchText,
      long absoluteOffset,
      List<Submatch> submatches)
      implements SearchHit {
    public LiteralHit {
      submatches = List.copyOf(submatches);
    }
  }

  /** A symbol definition; lines and characters are 1-based. */
  record StructuralHit(
      String symbol,
      String filePath,
      int startLine,
      int startCharacter,
      int endLine,
      int endCharacter)
      implements SearchHit {}
}
