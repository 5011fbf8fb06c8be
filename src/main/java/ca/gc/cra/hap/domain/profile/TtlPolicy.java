package ca.gc.cra.hap.domain.profile;

import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;

/**
 * Attestation lifetime bounds in seconds.
 *
 * @param defaultSeconds lifetime used when the request names none
 * @param maxSeconds largest lifetime a request may ask for
 * @since 0.3.0
 */
public record TtlPolicy(long defaultSeconds, long maxSeconds) {

  public TtlPolicy {
    if (defaultSeconds <= 0 || maxSeconds <= 0 || defaultSeconds > maxSeconds) {
      throw new IllegalArgumentException("invalid ttl policy " + defaultSeconds + "/" + maxSeconds);
    }
  }

  /**
   * Resolves the effective TTL for a request.
   *
   * @param requested requested TTL, or {@code null} for the default
   * @return effective TTL in seconds
   * @throws ProtocolException {@link ErrorCode#TTL_EXCEEDED} when the value is not in {@code (0, max]}
   */
  public long resolve(Long requested) {
    long ttl = requested == null ? defaultSeconds : requested;
    if (ttl <= 0 || ttl > maxSeconds) {
      throw new ProtocolException(
          ErrorCode.TTL_EXCEEDED, "ttl " + ttl + " outside (0, " + maxSeconds + "]");
    }
    return ttl;
  }
}
