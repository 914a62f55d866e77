package dev.fathom.literal;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for literal search.
 *
 * <p>Properties are bound from {@code fathom.literal.*}.
 *
 * <ul>
 *   <li>{@code command} - ripgrep executable (default {@code rg}, resolved on the PATH)
 *   <li>{@code timeout} - maximum duration of one search (default 30s)
 *   <li>{@code context-lines} - lines of context ripgrep reports around matches (default 1,
 *       bounded [0, 10])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "fathom.literal")
public class LiteralSearchProperties {

  private String command = "rg";
  private Duration timeout = Duration.ofSeconds(30);
  private int contextLines = 1;

  @PostConstruct
  void validate() {
    if (command == null || command.isBlank()) {
      throw new IllegalStateException("fathom.literal.command must not be blank");
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalStateException("fathom.literal.timeout must be positive, got: " + timeout);
    }
    if (contextLines < 0 || contextLines > 10) {
      throw new IllegalStateException(
          "fathom.literal.context-lines must be in [0, 10], got: " + contextLines);
    }
  }

  public String getCommand() {
    return command;
  }

  public void setCommand(String command) {
    this.command = command;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public int getContextLines() {
    return contextLines;
  }

  public void setContextLines(int contextLines) {
    this.contextLines = contextLines;
  }
}
