package dev.fathom.search;

import jakarta.annotation.PostConstruct;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for query routing.
 *
 * <p>Properties are bound from {@code fathom.search.*}.
 *
 * <ul>
 *   <li>{@code default-top-k} - semantic results when the caller gives no count (default 5)
 *   <li>{@code max-top-k} - upper bound applied to every requested count (default 50, bounded [1,
 *       1000])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "fathom.search")
public class SearchProperties {

  private int defaultTopK = SearchQuery.DEFAULT_TOP_K;
  private int maxTopK = 50;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxTopK < 1 || maxTopK > 1000) {
      throw new IllegalStateException(
          "fathom.search.max-top-k must be in [1, 1000], got: " + maxTopK);
    }
    if (defaultTopK < 1 || defaultTopK > maxTopK) {
      throw new IllegalStateException(
          "fathom.search.default-top-k must be in [1, max-top-k], got: " + defaultTopK);
    }
  }

  /** Clamps a requested result count to [1, max-top-k]; null selects the default. */
  public int clampTopK(@Nullable Integer requested) {
    if (requested == null) {
      return defaultTopK;
    }
    return Math.max(1, Math.min(requested, maxTopK));
  }

  public int getDefaultTopK() {
    return defaultTopK;
  }

  public void setDefaultTopK(int defaultTopK) {
    this.defaultTopK = defaultTopK;
  }

  public int getMaxTopK() {
    return maxTopK;
  }

  public void setMaxTopK(int maxTopK) {
    this.maxTopK = maxTopK;
  }
}
