package dev.fathom.indexing;

/** Terminal state of a semantic index run. */
public enum IndexRunStatus {
  /** All files were processed and the project's index timestamp was updated. */
  INDEXED,
  /** The project contains no source files; nothing was written. */
  NO_SOURCE_FILES,
  /** The run was interrupted between files; the index timestamp was left unchanged. */
  CANCELLED
}
