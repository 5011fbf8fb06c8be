package ca.gc.cra.hap.domain.error;

import java.util.Locale;

/**
 * Stable machine-readable failure codes surfaced by every protocol operation.
 *
 * <p>Codes are part of the external contract: CLI output, executor decisions, and metrics names
 * embed {@link #wireName()} so they must never be renamed.</p>
 *
 * @since 0.3.0
 */
public enum ErrorCode {
  /** Input failed schema or format validation. */
  VALIDATION_ERROR,
  /** Attestation blob could not be decoded into a header, payload, and signature. */
  MALFORMED_ATTESTATION,
  /** Signature did not verify or the signing key could not be resolved. */
  INVALID_SIGNATURE,
  /** Attestation {@code expires_at} is at or before the current time. */
  EXPIRED,
  /** Attested frame hash differs from the recomputed one. */
  FRAME_MISMATCH,
  /** Attestation was issued under a different profile than the executor expects. */
  PROFILE_MISMATCH,
  /** Attestation names a different execution path than the one requested. */
  PATH_MISMATCH,
  /** Attested scopes do not cover the execution path requirements. */
  SCOPE_INSUFFICIENT,
  /** Profile identifier is not registered. */
  UNKNOWN_PROFILE,
  /** Execution path is not defined by the profile. */
  UNKNOWN_EXECUTION_PATH,
  /** One or more required gates were not resolved before signing. */
  MISSING_GATES,
  /** Requested TTL is non-positive or above the profile maximum. */
  TTL_EXCEEDED;

  /**
   * Returns the lowercase dotted form used in metric names.
   *
   * @return lowercase code, e.g. {@code invalid_signature}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
