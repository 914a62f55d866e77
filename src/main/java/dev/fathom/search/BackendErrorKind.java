package dev.fathom.search;

/** Classification of a failed search backend call. */
public enum BackendErrorKind {
  /** The backend tool or store is not available. */
  UNAVAILABLE,
  /** The backend ran and reported an error. */
  PROCESS_FAILURE,
  TIMEOUT,
  /** Any other unexpected failure. */
  INTERNAL
}
