package ca.gc.cra.hap.application.attestation;

import ca.gc.cra.hap.domain.attestation.DecisionOwnerScope;
import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import java.util.List;
import java.util.Objects;

/**
 * Request to the signing authority, one shape per protocol generation.
 *
 * @since 0.3.0
 */
public sealed interface AttestationRequest permits AttestationRequest.V02, AttestationRequest.V03 {

  String profileId();

  String executionPath();

  String frameHash();

  /** Requested lifetime in seconds, or {@code null} for the profile default. */
  Long ttlSeconds();

  ProtocolVersion version();

  /**
   * v0.2 request: gates resolved in the review UI plus decision owners and their scopes.
   */
  record V02(
      String profileId,
      String executionPath,
      String frameHash,
      List<String> resolvedGates,
      List<String> decisionOwners,
      List<DecisionOwnerScope> decisionOwnerScopes,
      Long ttlSeconds)
      implements AttestationRequest {

    public V02 {
      resolvedGates = resolvedGates == null ? List.of() : List.copyOf(resolvedGates);
      decisionOwners = decisionOwners == null ? List.of() : List.copyOf(decisionOwners);
      decisionOwnerScopes = decisionOwnerScopes == null ? List.of() : List.copyOf(decisionOwnerScopes);
    }

    @Override
    public ProtocolVersion version() {
      return ProtocolVersion.V0_2;
    }
  }

  /**
   * v0.3 request: a single domain owner attesting to one domain disclosure.
   */
  record V03(
      String profileId,
      String executionPath,
      String frameHash,
      String domain,
      String did,
      String env,
      String domainDisclosureHash,
      Long ttlSeconds)
      implements AttestationRequest {

    public V03 {
      Objects.requireNonNull(domain, "domain");
    }

    @Override
    public ProtocolVersion version() {
      return ProtocolVersion.V0_3;
    }
  }
}
