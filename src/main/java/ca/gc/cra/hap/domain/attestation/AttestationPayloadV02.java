package ca.gc.cra.hap.domain.attestation;

import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import java.util.List;
import java.util.Objects;

/**
 * v0.2 payload: gates, decision owners, and their scopes.
 *
 * @since 0.3.0
 */
public record AttestationPayloadV02(
    String attestationId,
    String profileId,
    String frameHash,
    List<String> resolvedGates,
    List<String> decisionOwners,
    List<DecisionOwnerScope> decisionOwnerScopes,
    long issuedAt,
    long expiresAt)
    implements AttestationPayload {

  public AttestationPayloadV02 {
    Objects.requireNonNull(attestationId, "attestationId");
    Objects.requireNonNull(profileId, "profileId");
    Objects.requireNonNull(frameHash, "frameHash");
    resolvedGates = List.copyOf(resolvedGates);
    decisionOwners = List.copyOf(decisionOwners);
    decisionOwnerScopes = List.copyOf(decisionOwnerScopes);
  }

  @Override
  public ProtocolVersion version() {
    return ProtocolVersion.V0_2;
  }

  @Override
  public List<AttestedScope> scopes() {
    return decisionOwnerScopes.stream().map(DecisionOwnerScope::toScope).toList();
  }
}
