package dev.fathom.mcp;

import dev.fathom.search.SearchHit;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Truncates search hits to fit within a configurable token budget.
 *
 * <p>Uses character-based token estimation (chars / 4). Hits are formatted as readable text blocks
 * with file locations, then accumulated until the token budget is reached.
 *
 * <p>If even the first hit exceeds the budget, it is included but truncated at the character level
 * so at least one hit is always returned.
 */
@Component
public class TokenBudgetTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${fathom.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats and truncates hits to fit within the configured token budget.
   *
   * @param hits the hits to format, in rank order
   * @return formatted text containing as many hits as fit within the token budget
   */
  public String truncate(@Nullable List<? extends SearchHit> hits) {
    if (hits == null || hits.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < hits.size(); i++) {
      String formatted = format(i + 1, hits.get(i));
      int hitTokens = estimateTokens(formatted);

      if (i == 0 && hitTokens > tokenBudget) {
        // First hit exceeds budget: truncate at character level
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }

      if (estimatedTokens + hitTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += hitTokens;
    }

    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String format(int index, SearchHit hit) {
    if (hit instanceof SearchHit.SemanticHit semantic) {
      Map<String, Object> metadata = semantic.metadata();
      return String.format(
          Locale.ROOT,
          "## [%d] %s:%s-%s\nMethod: %s.%s%s\nDistance: %.3f\n\n```java\n%s\n```\n\n---\n",
          index,
          metadata.getOrDefault("file_path", "?"),
          metadata.getOrDefault("start_line", "?"),
          metadata.getOrDefault("end_line", "?"),
          metadata.getOrDefault("class_name", "N/A"),
          metadata.getOrDefault("method_name", "?"),
          metadata.getOrDefault("parameters", ""),
          semantic.distance(),
          semantic.document());
    }
    if (hit instanceof SearchHit.LiteralHit literal) {
      return "[%d] %s:%d: %s\n".formatted(
          index, literal.filePath(), literal.lineNumber(), literal.matchText());
    }
    SearchHit.StructuralHit structural = (SearchHit.StructuralHit) hit;
    return "[%d] %s:%d:%d-%d:%d %s\n"
        .formatted(
            index,
            structural.filePath(),
            structural.startLine(),
            structural.startCharacter(),
            structural.endLine(),
            structural.endCharacter(),
            structural.symbol());
  }
}
