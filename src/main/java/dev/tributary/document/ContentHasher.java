package dev.tributary.document;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Static utility for computing SHA-256 hashes. Used for deterministic element ids and for naming
 * per-source download directories; never for cache decisions.
 */
public final class ContentHasher {

  private ContentHasher() {
    // utility class
  }

  /**
   * Compute the SHA-256 hash of the given content.
   *
   * @param content the content to hash
   * @return lowercase hex string of the SHA-256 hash
   */
  public static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /**
   * Compute a truncated SHA-256 hash.
   *
   * @param content the content to hash
   * @param length number of hex characters to keep (1-64)
   * @return the first {@code length} hex characters of the hash
   */
  public static String sha256Prefix(String content, int length) {
    if (length < 1 || length > 64) {
      throw new IllegalArgumentException("length must be between 1 and 64");
    }
    return sha256(content).substring(0, length);
  }
}
