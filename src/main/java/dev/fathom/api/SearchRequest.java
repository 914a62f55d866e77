package dev.fathom.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import dev.fathom.search.SearchType;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code POST /search}. Snake-case aliases ({@code project_name}, {@code
 * search_type}, {@code n_results}) are accepted as well.
 *
 * @param projectName registered project name
 * @param query query text
 * @param searchType modality; required, a missing value is rejected with 400
 * @param topK maximum number of semantic results, configured default when absent
 */
public record SearchRequest(
    @JsonAlias("project_name") @Nullable String projectName,
    @Nullable String query,
    @JsonAlias("search_type") @Nullable SearchType searchType,
    @JsonAlias({"top_k", "n_results"}) @Nullable Integer topK) {}
