package dev.fathom.indexing;

/** Per-project index artifacts. Builds of different artifacts may run concurrently. */
public enum IndexArtifact {
  SEMANTIC,
  STRUCTURAL
}
