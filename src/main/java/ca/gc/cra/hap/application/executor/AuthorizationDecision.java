package ca.gc.cra.hap.application.executor;

import ca.gc.cra.hap.domain.attestation.AttestedScope;
import java.util.List;

/**
 * Everything an executor learns from a granted authorization. Carries identifiers, hashes, and
 * scopes only.
 *
 * @param attestationId content hash of the primary blob
 * @param frameHash authorized frame hash
 * @param profileId governing profile
 * @param executionPath authorized path
 * @param scopes scopes from every verified attestation that contributed, sorted
 * @param issuedAt primary attestation issue time, epoch seconds
 * @param expiresAt earliest expiry among contributing attestations, epoch seconds
 * @since 0.3.0
 */
public record AuthorizationDecision(
    String attestationId,
    String frameHash,
    String profileId,
    String executionPath,
    List<AttestedScope> scopes,
    long issuedAt,
    long expiresAt) {

  public AuthorizationDecision {
    scopes = List.copyOf(scopes);
  }
}
