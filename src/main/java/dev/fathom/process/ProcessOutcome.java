package dev.fathom.process;

import java.time.Duration;

/** Result of running an external command. */
public sealed interface ProcessOutcome {

  /** The process exited on its own. */
  record Completed(int exitCode, String stdout, String stderr) implements ProcessOutcome {

    public boolean isSuccess() {
      return exitCode == 0;
    }
  }

  /** The executable does not exist or is not on the PATH. */
  record ExecutableNotFound(String executable) implements ProcessOutcome {}

  /**
   * The process could not be started for another reason, such as a missing working directory or
   * a permission error.
   */
  record StartFailed(String executable, String message) implements ProcessOutcome {}

  /** The process ran past its timeout and was killed. */
  record TimedOut(Duration timeout) implements ProcessOutcome {}
}
