package dev.fathom.literal;

import dev.fathom.process.ProcessOutcome;
import dev.fathom.process.ProcessRunner;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Literal search through ripgrep.
 *
 * <p>The pattern is matched as a fixed, case-sensitive string and is passed after {@code --} so a
 * pattern starting with a dash is never read as an option. ripgrep exits with 0 when it found
 * matches, 1 when it found none and 2 or more on errors.
 */
@Service
public class RipgrepSearchService {

  private static final Logger log = LoggerFactory.getLogger(RipgrepSearchService.class);

  static final int EXIT_MATCHES = 0;
  static final int EXIT_NO_MATCHES = 1;

  private final ProcessRunner processRunner;
  private final RipgrepOutputParser outputParser;
  private final LiteralSearchProperties properties;

  public RipgrepSearchService(
      ProcessRunner processRunner,
      RipgrepOutputParser outputParser,
      LiteralSearchProperties properties) {
    this.processRunner = processRunner;
    this.outputParser = outputParser;
    this.properties = properties;
  }

  /**
   * Searches every file under {@code projectRoot} for {@code pattern}.
   *
   * @param projectRoot directory to search
   * @param pattern text to find verbatim
   * @return matches, or the reason the search failed
   */
  public LiteralSearchOutcome search(Path projectRoot, String pattern) {
    ProcessOutcome outcome =
        processRunner.run(command(projectRoot, pattern), null, properties.getTimeout());

    if (outcome instanceof ProcessOutcome.ExecutableNotFound notFound) {
      log.error("ripgrep executable '{}' not found", notFound.executable());
      return new LiteralSearchOutcome.ToolMissing(notFound.executable());
    }
    if (outcome instanceof ProcessOutcome.StartFailed startFailed) {
      return new LiteralSearchOutcome.StartFailed(startFailed.executable(), startFailed.message());
    }
    if (outcome instanceof ProcessOutcome.TimedOut timedOut) {
      return new LiteralSearchOutcome.TimedOut(timedOut.timeout());
    }
    ProcessOutcome.Completed completed = (ProcessOutcome.Completed) outcome;
    return switch (completed.exitCode()) {
      case EXIT_MATCHES -> new LiteralSearchOutcome.Success(outputParser.parse(completed.stdout()));
      case EXIT_NO_MATCHES -> new LiteralSearchOutcome.NoMatches();
      default -> {
        log.warn("ripgrep exited with {}: {}", completed.exitCode(), completed.stderr().strip());
        yield new LiteralSearchOutcome.ToolError(completed.exitCode(), completed.stderr());
      }
    };
  }

  List<String> command(Path projectRoot, String pattern) {
    return List.of(
        properties.getCommand(),
        "--json",
        "--line-number",
        "--context",
        String.valueOf(properties.getContextLines()),
        "--fixed-strings",
        "--case-sensitive",
        "--",
        pattern,
        projectRoot.toString());
  }
}
