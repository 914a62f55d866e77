package dev.fathom.structural;

/** Raised when a dotted symbol name cannot be turned into a SCIP descriptor. */
public class InvalidSymbolQueryException extends IllegalArgumentException {

  private final String query;

  public InvalidSymbolQueryException(String query, String message) {
    super(message);
    this.query = query;
  }

  public String getQuery() {
    return query;
  }
}
