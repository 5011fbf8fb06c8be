package ca.gc.cra.hap.domain.attestation;

import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import java.util.List;
import java.util.Objects;

/**
 * v0.3 payload: one or more resolved domains, each bound to its own disclosure hash.
 *
 * @since 0.3.0
 */
public record AttestationPayloadV03(
    String attestationId,
    String profileId,
    String frameHash,
    List<ResolvedDomain> resolvedDomains,
    long issuedAt,
    long expiresAt)
    implements AttestationPayload {

  public AttestationPayloadV03 {
    Objects.requireNonNull(attestationId, "attestationId");
    Objects.requireNonNull(profileId, "profileId");
    Objects.requireNonNull(frameHash, "frameHash");
    resolvedDomains = List.copyOf(resolvedDomains);
  }

  @Override
  public ProtocolVersion version() {
    return ProtocolVersion.V0_3;
  }

  @Override
  public List<AttestedScope> scopes() {
    return resolvedDomains.stream().map(ResolvedDomain::toScope).toList();
  }
}
