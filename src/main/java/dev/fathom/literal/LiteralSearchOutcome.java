package dev.fathom.literal;

import java.time.Duration;
import java.util.List;

/** Result of a literal search. Only {@link Success} and {@link NoMatches} are normal outcomes. */
public sealed interface LiteralSearchOutcome {

  record Success(List<LiteralMatch> matches) implements LiteralSearchOutcome {
    public Success {
      matches = List.copyOf(matches);
    }
  }

  record NoMatches() implements LiteralSearchOutcome {}

  /** The search tool is not installed or not on the PATH. */
  record ToolMissing(String executable) implements LiteralSearchOutcome {}

  /** The search tool is installed but could not be started. */
  record StartFailed(String executable, String message) implements LiteralSearchOutcome {}

  /** The search tool exited with an error status. */
  record ToolError(int exitCode, String stderr) implements LiteralSearchOutcome {}

  record TimedOut(Duration timeout) implements LiteralSearchOutcome {}
}
