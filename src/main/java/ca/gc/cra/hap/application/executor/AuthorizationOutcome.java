package ca.gc.cra.hap.application.executor;

import ca.gc.cra.hap.domain.error.ErrorCode;

/**
 * Grant-or-deny wrapper for callers that prefer a value over an exception.
 *
 * @param authorized whether execution may proceed
 * @param decision decision when granted, otherwise {@code null}
 * @param error failure code when denied, otherwise {@code null}
 * @param reason failure message when denied, otherwise {@code null}
 * @since 0.3.0
 */
public record AuthorizationOutcome(
    boolean authorized, AuthorizationDecision decision, ErrorCode error, String reason) {

  static AuthorizationOutcome granted(AuthorizationDecision decision) {
    return new AuthorizationOutcome(true, decision, null, null);
  }

  static AuthorizationOutcome denied(ErrorCode error, String reason) {
    return new AuthorizationOutcome(false, null, error, reason);
  }
}
