package ca.gc.cra.hap.infrastructure.crypto;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Converts Ed25519 keys between the JDK encodings and the raw 32-byte hex form used in configuration
 * and by {@code hap pubkey}.
 *
 * @since 0.3.0
 */
public final class Ed25519Keys {
  public static final String ALGORITHM = "Ed25519";
  static final int RAW_KEY_LENGTH = 32;

  private static final HexFormat HEX = HexFormat.of();
  private static final byte[] X509_PREFIX = HEX.parseHex("302a300506032b6570032100");
  private static final byte[] PKCS8_PREFIX = HEX.parseHex("302e020100300506032b657004220420");

  private Ed25519Keys() {
    // Utility
  }

  /**
   * Generates a fresh key pair.
   *
   * @return new Ed25519 key pair
   * @throws IllegalStateException when the JDK lacks Ed25519
   */
  public static KeyPair generate() {
    try {
      return KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Ed25519 is not available in this JDK", ex);
    }
  }

  /**
   * Parses a raw 32-byte public key.
   *
   * @param hex 64 hex characters
   * @return public key
   * @throws IllegalArgumentException when the text is not a 32-byte key
   */
  public static PublicKey publicKeyFromHex(String hex) {
    byte[] raw = parseRaw(hex, "public key");
    try {
      return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(concat(X509_PREFIX, raw)));
    } catch (GeneralSecurityException ex) {
      throw new IllegalArgumentException("Invalid Ed25519 public key", ex);
    }
  }

  /**
   * Parses a raw 32-byte private key seed.
   *
   * @param hex 64 hex characters
   * @return private key
   * @throws IllegalArgumentException when the text is not a 32-byte seed
   */
  public static PrivateKey privateKeyFromHex(String hex) {
    byte[] raw = parseRaw(hex, "private key");
    try {
      return KeyFactory.getInstance(ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(concat(PKCS8_PREFIX, raw)));
    } catch (GeneralSecurityException ex) {
      throw new IllegalArgumentException("Invalid Ed25519 private key", ex);
    } finally {
      Arrays.fill(raw, (byte) 0);
    }
  }

  /**
   * Renders a public key as raw hex.
   *
   * @param key Ed25519 public key with X.509 encoding
   * @return 64 lowercase hex characters
   */
  public static String toHex(PublicKey key) {
    byte[] encoded = key.getEncoded();
    if (encoded == null || encoded.length != X509_PREFIX.length + RAW_KEY_LENGTH) {
      throw new IllegalArgumentException("Not an Ed25519 X.509 public key");
    }
    return HEX.formatHex(encoded, X509_PREFIX.length, encoded.length);
  }

  /**
   * Renders a private key seed as raw hex.
   *
   * @param key Ed25519 private key with PKCS#8 encoding
   * @return 64 lowercase hex characters
   */
  public static String toHex(PrivateKey key) {
    byte[] encoded = key.getEncoded();
    if (encoded == null || encoded.length < PKCS8_PREFIX.length + RAW_KEY_LENGTH
        || !Arrays.equals(encoded, 0, PKCS8_PREFIX.length, PKCS8_PREFIX, 0, PKCS8_PREFIX.length)) {
      throw new IllegalArgumentException("Not an Ed25519 PKCS#8 private key");
    }
    return HEX.formatHex(encoded, PKCS8_PREFIX.length, PKCS8_PREFIX.length + RAW_KEY_LENGTH);
  }

  private static byte[] parseRaw(String hex, String label) {
    if (hex == null || hex.isBlank()) {
      throw new IllegalArgumentException("Ed25519 " + label + " is empty");
    }
    String trimmed = hex.trim();
    if (trimmed.length() != RAW_KEY_LENGTH * 2) {
      throw new IllegalArgumentException("Ed25519 " + label + " must be " + RAW_KEY_LENGTH * 2 + " hex characters");
    }
    try {
      return HEX.parseHex(trimmed.toLowerCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Ed25519 " + label + " is not hex", ex);
    }
  }

  private static byte[] concat(byte[] prefix, byte[] raw) {
    byte[] out = Arrays.copyOf(prefix, prefix.length + raw.length);
    System.arraycopy(raw, 0, out, prefix.length, raw.length);
    return out;
  }
}
