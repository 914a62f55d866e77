package dev.fathom.structural;

import java.util.List;

/** Immutable snapshot of a decoded SCIP index. */
public record ScipIndex(List<ScipDocument> documents) {

  public ScipIndex {
    documents = List.copyOf(documents);
  }
}
