package dev.fathom.structural;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for structural search.
 *
 * <p>Properties are bound from {@code fathom.structural.*}.
 *
 * <ul>
 *   <li>{@code index-dir} - directory holding one SCIP index per project (default {@code
 *       .fathom_indexes/scip}, relative to the working directory)
 *   <li>{@code indexer-command} - scip-java executable (default {@code scip-java})
 *   <li>{@code indexer-timeout} - maximum duration of one index build (default 10m)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "fathom.structural")
public class StructuralProperties {

  private String indexDir = ".fathom_indexes/scip";
  private String indexerCommand = "scip-java";
  private Duration indexerTimeout = Duration.ofMinutes(10);

  @PostConstruct
  void validate() {
    if (indexDir == null || indexDir.isBlank()) {
      throw new IllegalStateException("fathom.structural.index-dir must not be blank");
    }
    if (indexerCommand == null || indexerCommand.isBlank()) {
      throw new IllegalStateException("fathom.structural.indexer-command must not be blank");
    }
    if (indexerTimeout.isNegative() || indexerTimeout.isZero()) {
      throw new IllegalStateException(
          "fathom.structural.indexer-timeout must be positive, got: " + indexerTimeout);
    }
  }

  public String getIndexDir() {
    return indexDir;
  }

  public void setIndexDir(String indexDir) {
    this.indexDir = indexDir;
  }

  public String getIndexerCommand() {
    return indexerCommand;
  }

  public void setIndexerCommand(String indexerCommand) {
    this.indexerCommand = indexerCommand;
  }

  public Duration getIndexerTimeout() {
    return indexerTimeout;
  }

  public void setIndexerTimeout(Duration indexerTimeout) {
    this.indexerTimeout = indexerTimeout;
  }
}
