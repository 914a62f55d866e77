package dev.fathom.mcp;

import java.time.Instant;

/** How the last background index build of one artifact ended. */
record BuildOutcome(boolean succeeded, String detail, Instant finishedAt) {

  static BuildOutcome success(String detail) {
    return new BuildOutcome(true, detail, Instant.now());
  }

  static BuildOutcome failure(String detail) {
    return new BuildOutcome(false, detail, Instant.now());
  }

  String describe() {
    return (succeeded ? "last build succeeded at %s: %s" : "last build failed at %s: %s")
        .formatted(finishedAt, detail);
  }
}
