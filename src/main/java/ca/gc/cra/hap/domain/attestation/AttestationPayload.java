package ca.gc.cra.hap.domain.attestation;

import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import java.util.List;

/**
 * Signed claims of an attestation. Each protocol generation has its own payload shape.
 *
 * @since 0.3.0
 */
public sealed interface AttestationPayload permits AttestationPayloadV02, AttestationPayloadV03 {

  String attestationId();

  ProtocolVersion version();

  String profileId();

  String frameHash();

  long issuedAt();

  long expiresAt();

  /**
   * Returns the scopes this payload confers, regardless of generation.
   *
   * @return attested scopes in payload order
   */
  List<AttestedScope> scopes();
}
