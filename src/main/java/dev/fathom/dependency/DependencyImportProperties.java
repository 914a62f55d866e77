package dev.fathom.dependency;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for importing dependency sources.
 *
 * <p>Properties are bound from {@code fathom.dependency.*}.
 *
 * <ul>
 *   <li>{@code maven-repository} - local Maven repository scanned for {@code *-sources.jar}
 *       (default {@code ~/.m2/repository})
 *   <li>{@code extract-dir} - directory receiving one extracted tree per jar (default {@code
 *       .fathom_deps}, relative to the working directory)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "fathom.dependency")
public class DependencyImportProperties {

  private String mavenRepository =
      Path.of(System.getProperty("user.home"), ".m2", "repository").toString();
  private String extractDir = ".fathom_deps";

  @PostConstruct
  void validate() {
    if (mavenRepository == null || mavenRepository.isBlank()) {
      throw new IllegalStateException("fathom.dependency.maven-repository must not be blank");
    }
    if (extractDir == null || extractDir.isBlank()) {
      throw new IllegalStateException("fathom.dependency.extract-dir must not be blank");
    }
  }

  public String getMavenRepository() {
    return mavenRepository;
  }

  public void setMavenRepository(String mavenRepository) {
    this.mavenRepository = mavenRepository;
  }

  public String getExtractDir() {
    return extractDir;
  }

  public void setExtractDir(String extractDir) {
    this.extractDir = extractDir;
  }
}
