package dev.fathom.structural;

/** Raised for symbol names with fewer than two segments, such as a bare method name. */
public class QueryTooShortException extends InvalidSymbolQueryException {

  public QueryTooShortException(String query) {
    super(
        query,
        "Structural query '%s' needs at least a type and a method, e.g. com.example.Main.greet"
            .formatted(query));
  }
}
