package ca.gc.cra.hap.application.canonical;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * SHA-256 content hashing in the {@code sha256:<64 lowercase hex>} form used for frame hashes,
 * disclosure hashes, and attestation identifiers.
 *
 * @since 0.3.0
 */
public final class ContentHasher {
  public static final String PREFIX = "sha256:";
  private static final Pattern HASH_PATTERN = Pattern.compile("^sha256:[a-f0-9]{64}$");
  private static final HexFormat HEX = HexFormat.of();

  private ContentHasher() {
    // Utility
  }

  /**
   * Hashes the UTF-8 encoding of {@code content}.
   *
   * @param content text to hash; must not be {@code null}
   * @return prefixed lowercase hex digest
   */
  public static String hash(String content) {
    Objects.requireNonNull(content, "content");
    return PREFIX + HEX.formatHex(sha256().digest(content.getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Tests whether a value has the content-hash shape.
   *
   * @param value candidate
   * @return {@code true} for {@code sha256:} followed by 64 lowercase hex digits
   */
  public static boolean isContentHash(String value) {
    return value != null && HASH_PATTERN.matcher(value).matches();
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
