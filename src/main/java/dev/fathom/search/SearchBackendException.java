package dev.fathom.search;

import org.jspecify.annotations.Nullable;

/** Raised by {@link SearchRouter} when a search backend fails. */
public class SearchBackendException extends RuntimeException {

  private final SearchType searchType;
  private final BackendErrorKind kind;

  public SearchBackendException(SearchType searchType, BackendErrorKind kind, String message) {
    this(searchType, kind, message, null);
  }

  public SearchBackendException(
      SearchType searchType, BackendErrorKind kind, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.searchType = searchType;
    this.kind = kind;
  }

  public SearchType getSearchType() {
    return searchType;
  }

  public BackendErrorKind getKind() {
    return kind;
  }
}
