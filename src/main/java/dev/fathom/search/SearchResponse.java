package dev.fathom.search;

import java.util.List;

/**
 * Envelope returned for every routed query.
 *
 * @param searchType the modality that answered
 * @param results hits, possibly empty
 * @param message {@value #SUCCESS}, or why the results are empty
 */
public record SearchResponse(SearchType searchType, List<SearchHit> results, String message) {

  public static final String SUCCESS = "Success";

  public SearchResponse {
    results = List.copyOf(results);
  }

  static SearchResponse success(SearchType searchType, List<? extends SearchHit> results) {
    return new SearchResponse(searchType, List.copyOf(results), SUCCESS);
  }

  static SearchResponse empty(SearchType searchType, String message) {
    return new SearchResponse(searchType, List.of(), message);
  }
}
