package ca.gc.cra.hap.logging;

/**
 * <strong>What:</strong> Log hygiene helpers for attestation material.
 * <p><strong>Why:</strong> Blobs are long bearer tokens and private keys are secrets; neither belongs in
 * operator logs in full.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.3.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Shortens a value to {@code maxChars} characters, noting the original length.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxChars characters to keep; must be positive
   * @return the value unchanged when short enough, otherwise a prefix with a length suffix
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end) + "... (truncated, " + end + " of " + value.length() + ")";
  }

  /**
   * Returns the redaction placeholder used for key material.
   *
   * @param value ignored
   * @return {@code [REDACTED]}
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }
}
