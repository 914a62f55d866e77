package dev.fathom.extraction;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.jspecify.annotations.Nullable;

/**
 * Static utility computing the SHA-256 identity of a snippet.
 *
 * <p>The digest covers {@code filePath|className|methodName|startLine}, with the empty string for
 * any missing component. Code content is deliberately left out: an edited body at the same
 * location keeps its identity and overwrites the stored vector, while a method that moves or is
 * renamed gets a new identity.
 */
public final class SnippetFingerprint {

  private static final char SEPARATOR = '|';

  private SnippetFingerprint() {
    // utility class
  }

  /**
   * Computes the fingerprint for a snippet location.
   *
   * @return lowercase hex string of the SHA-256 digest
   */
  public static String of(
      @Nullable String filePath,
      @Nullable String className,
      @Nullable String methodName,
      int startLine) {
    String identity =
        nullToEmpty(filePath)
            + SEPARATOR
            + nullToEmpty(className)
            + SEPARATOR
            + nullToEmpty(methodName)
            + SEPARATOR
            + startLine;
    return sha256(identity);
  }

  static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  private static String nullToEmpty(@Nullable String value) {
    return value == null ? "" : value;
  }
}
