package dev.fathom.vector;

import java.util.List;

/** Outcome of a semantic query against a project's collection. */
public sealed interface SemanticQueryResult {

  /** Matches ordered by ascending distance. */
  record Found(List<SemanticMatch> matches) implements SemanticQueryResult {
    public Found {
      matches = List.copyOf(matches);
    }
  }

  /** The project has no collection yet, usually because it was never indexed. */
  record CollectionNotFound(String collection) implements SemanticQueryResult {}
}
