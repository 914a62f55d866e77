package dev.fathom.structural;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Maps a project name to the location of its SCIP index.
 *
 * <p>Indexes live in {@code fathom.structural.index-dir} as {@code <name>.scip}. Characters that
 * are unsafe in file names are replaced with {@code _}; when that changes the name, a short hash of
 * the original name is appended so distinct projects never share an index file.
 */
@Component
public class StructuralIndexLocator {

  static final String EXTENSION = ".scip";

  private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

  private final Path indexDir;

  public StructuralIndexLocator(StructuralProperties properties) {
    this.indexDir = Path.of(properties.getIndexDir()).toAbsolutePath().normalize();
  }

  public Path indexFor(String projectName) {
    return indexDir.resolve(fileStem(projectName) + EXTENSION);
  }

  public Path getIndexDir() {
    return indexDir;
  }

  static String fileStem(String projectName) {
    String sanitised = UNSAFE_CHARS.matcher(projectName).replaceAll("_");
    if (sanitised.startsWith(".")) {
      sanitised = "_" + sanitised.substring(1);
    }
    if (sanitised.equals(projectName)) {
      return sanitised;
    }
    return sanitised + "_" + shortHash(projectName);
  }

  private static String shortHash(String value) {
    try {
      byte[] hash =
          MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash, 0, 4);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
