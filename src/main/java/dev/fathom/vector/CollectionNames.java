package dev.fathom.vector;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives the vector collection name of a project.
 *
 * <p>Names have the form {@code <prefix>_<sanitised project name>_<hash>} where the hash is the
 * first 12 hex characters of the SHA-256 of the raw project name. Sanitising alone could map two
 * project names to the same collection ({@code "a-b"} and {@code "a b"}); the hash keeps them apart.
 * Every name is a valid unquoted PostgreSQL identifier of at most 63 characters.
 */
public class CollectionNames {

  static final int MAX_LENGTH = 63;
  static final int HASH_LENGTH = 12;

  private static final Pattern PREFIX = Pattern.compile("[a-z][a-z0-9_]*");
  private static final Pattern INVALID_CHARS = Pattern.compile("[^a-z0-9_]");

  private final String prefix;

  public CollectionNames(String prefix) {
    if (!PREFIX.matcher(prefix).matches()) {
      throw new IllegalArgumentException(
          "Collection prefix must match [a-z][a-z0-9_]*, got: " + prefix);
    }
    if (prefix.length() > MAX_LENGTH - HASH_LENGTH - 2) {
      throw new IllegalArgumentException("Collection prefix too long: " + prefix);
    }
    this.prefix = prefix;
  }

  /** Deterministic collection name for {@code projectName}. */
  public String forProject(String projectName) {
    String sanitised = INVALID_CHARS.matcher(projectName.toLowerCase(Locale.ROOT)).replaceAll("_");
    String hash = sha256Hex(projectName).substring(0, HASH_LENGTH);
    int room = MAX_LENGTH - prefix.length() - hash.length() - 2;
    if (sanitised.length() > room) {
      sanitised = sanitised.substring(0, room);
    }
    return prefix + "_" + sanitised + "_" + hash;
  }

  public String getPrefix() {
    return prefix;
  }

  private static String sha256Hex(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
