package ca.gc.cra.hap.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to signing and verification.
 * <p><strong>Why:</strong> Attestation issuance and expiry checks depend on "now"; tests inject a fixed
 * clock to exercise the expiry boundary exactly.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.3.0
 * @see ca.gc.cra.hap.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current epoch time in whole seconds, truncated.
   *
   * @return seconds since the epoch
   */
  default long nowSeconds() {
    return Math.floorDiv(nowMillis(), 1000L);
  }
}
