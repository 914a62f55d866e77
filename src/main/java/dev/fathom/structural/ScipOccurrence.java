package dev.fathom.structural;

import dev.fathom.structural.scip.Scip;
import java.util.List;

/**
 * One occurrence of a symbol in a document.
 *
 * @param symbol SCIP symbol string
 * @param symbolRoles bitmask of {@link Scip.SymbolRole} flags
 * @param range raw range integers, 0-based; see {@link OccurrenceRange#decode(List)}
 */
public record ScipOccurrence(String symbol, int symbolRoles, List<Integer> range) {

  public ScipOccurrence {
    range = List.copyOf(range);
  }

  public boolean isDefinition() {
    return (symbolRoles & Scip.SymbolRole.Definition_VALUE) != 0;
  }
}
