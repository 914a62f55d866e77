package dev.fathom.structural;

import java.util.Arrays;
import java.util.List;

/**
 * A method lookup parsed from a dotted name such as {@code com.example.Main.greet}.
 *
 * <p>The last segment is the method, the one before it the type, and the rest the package. The
 * query matches SCIP symbols ending with {@code <package>/<Type>#<method>().}; with only two
 * segments the package is empty and the suffix is {@code /<Type>#<method>().}. Matching is a plain
 * suffix test, so overloads that scip-java disambiguates as {@code <method>(+1).} are not found.
 */
public record SymbolQuery(String packagePath, String typeName, String methodName) {

  /**
   * Parses a dotted symbol name.
   *
   * @throws QueryTooShortException if the name has fewer than two segments
   * @throws InvalidSymbolQueryException if a segment is empty
   */
  public static SymbolQuery parse(String dotted) {
    String trimmed = dotted == null ? "" : dotted.strip();
    List<String> segments = Arrays.asList(trimmed.split("\\.", -1));
    if (trimmed.isEmpty() || segments.size() < 2) {
      throw new QueryTooShortException(trimmed);
    }
    if (segments.stream().anyMatch(String::isBlank)) {
      throw new InvalidSymbolQueryException(
          trimmed, "Structural query '%s' contains an empty segment".formatted(trimmed));
    }
    int size = segments.size();
    return new SymbolQuery(
        String.join("/", segments.subList(0, size - 2)),
        segments.get(size - 2),
        segments.get(size - 1));
  }

  /** The SCIP descriptor suffix of the method's first declaration. */
  public String descriptorSuffix() {
    return packagePath + "/" + typeName + "#" + methodName + "().";
  }

  /** True if {@code symbol} ends with {@link #descriptorSuffix()}. */
  public boolean matches(String symbol) {
    return symbol.endsWith(descriptorSuffix());
  }
}
