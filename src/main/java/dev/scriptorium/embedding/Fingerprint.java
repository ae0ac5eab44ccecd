package dev.scriptorium.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content address of a piece of text: lowercase hex SHA-256 of the UTF-8 bytes of the trimmed
 * text. Case is preserved, so {@code "Hello"} and {@code "hello"} have different fingerprints.
 */
public final class Fingerprint {

  /** Length of the raw digest in bytes. */
  public static final int BYTES = 32;

  private Fingerprint() {
    // utility class
  }

  /**
   * Computes the fingerprint of the given text.
   *
   * @param text the text to fingerprint; leading and trailing whitespace is ignored
   * @return 64-character lowercase hex string
   */
  public static String of(String text) {
    return HexFormat.of().formatHex(digest(text.trim()));
  }

  static byte[] toBytes(String fingerprint) {
    return HexFormat.of().parseHex(fingerprint);
  }

  private static byte[] digest(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(content.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
