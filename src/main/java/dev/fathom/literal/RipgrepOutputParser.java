package dev.fathom.literal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes the JSON Lines output of {@code rg --json}.
 *
 * <p>Only {@code match} records are kept; {@code begin}, {@code end}, {@code context} and {@code
 * summary} records are ignored. Lines that are not JSON, and match records lacking a field, are
 * discarded. ripgrep reports non UTF-8 content as base64 {@code bytes} instead of {@code text}: a
 * match on such a line is kept with empty match text, while a match whose path is not UTF-8 is
 * discarded.
 */
@Component
public class RipgrepOutputParser {

  private static final Logger log = LoggerFactory.getLogger(RipgrepOutputParser.class);

  private final ObjectMapper objectMapper;

  public RipgrepOutputParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public List<LiteralMatch> parse(String output) {
    List<LiteralMatch> matches = new ArrayList<>();
    for (String line : output.split("\n")) {
      if (line.isBlank()) {
        continue;
      }
      parseLine(line).ifPresent(matches::add);
    }
    return matches;
  }

  Optional<LiteralMatch> parseLine(String line) {
    JsonNode record;
    try {
      record = objectMapper.readTree(line);
    } catch (JsonProcessingException e) {
      log.debug("Discarding non-JSON ripgrep output line: {}", e.getOriginalMessage());
      return Optional.empty();
    }
    if (record == null || !"match".equals(record.path("type").asText())) {
      return Optional.empty();
    }
    JsonNode data = record.path("data");
    JsonNode path = data.path("path").path("text");
    JsonNode lines = data.path("lines").path("text");
    JsonNode lineNumber = data.path("line_number");
    JsonNode absoluteOffset = data.path("absolute_offset");
    if (!path.isTextual()
        || !lineNumber.canConvertToInt()
        || !absoluteOffset.isIntegralNumber()) {
      log.debug("Discarding incomplete ripgrep match record: {}", line);
      return Optional.empty();
    }

    List<Submatch> submatches = new ArrayList<>();
    for (JsonNode submatch : data.path("submatches")) {
      JsonNode text = submatch.path("match").path("text");
      if (text.isTextual() && submatch.path("start").canConvertToInt()
          && submatch.path("end").canConvertToInt()) {
        submatches.add(
            new Submatch(
                submatch.path("start").asInt(), submatch.path("end").asInt(), text.asText()));
      }
    }
    return Optional.of(
        new LiteralMatch(
            path.asText(),
            lineNumber.asInt(),
            lines.isTextual() ? lines.asText().strip() : "",
            absoluteOffset.asLong(),
            submatches));
  }
}
