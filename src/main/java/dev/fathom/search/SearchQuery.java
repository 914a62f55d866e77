package dev.fathom.search;

/**
 * A search over one registered project.
 *
 * @param projectName registered project name (must not be blank)
 * @param query natural-language text, literal pattern or dotted symbol name depending on {@code
 *     searchType} (must not be blank)
 * @param searchType modality to search with
 * @param topK maximum number of semantic results (must be >= 1)
 */
public record SearchQuery(String projectName, String query, SearchType searchType, int topK) {

  /** Default number of semantic results. */
  public static final int DEFAULT_TOP_K = 5;

  /** Compact constructor validating input. */
  public SearchQuery {
    if (projectName == null || projectName.isBlank()) {
      throw new IllegalArgumentException("projectName must not be blank");
    }
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (searchType == null) {
      throw new IllegalArgumentException(
          "searchType is required: one of semantic, literal, structural");
    }
    if (topK < 1) {
      throw new IllegalArgumentException("topK must be at least 1");
    }
  }

  public SearchQuery(String projectName, String query, SearchType searchType) {
    this(projectName, query, searchType, DEFAULT_TOP_K);
  }
}
