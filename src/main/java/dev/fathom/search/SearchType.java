package dev.fathom.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Search modality. Serialised in lower case ({@code "semantic"}). */
public enum SearchType {
  SEMANTIC,
  LITERAL,
  STRUCTURAL;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a modality name, ignoring case.
   *
   * @throws IllegalArgumentException if the name is not a known modality
   */
  @JsonCreator
  public static SearchType fromString(String value) {
    if (value != null) {
      for (SearchType type : values()) {
        if (type.name().equalsIgnoreCase(value.strip())) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException(
        "Unknown search type '%s', expected one of %s"
            .formatted(
                value,
                Arrays.stream(values())
                    .map(SearchType::wireName)
                    .collect(Collectors.joining(", ", "[", "]"))));
  }
}
