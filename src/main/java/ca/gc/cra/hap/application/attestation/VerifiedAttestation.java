package ca.gc.cra.hap.application.attestation;

import ca.gc.cra.hap.domain.attestation.Attestation;
import ca.gc.cra.hap.domain.attestation.AttestationPayload;

/**
 * Attestation whose signature and expiry have been checked.
 *
 * @param blob original blob
 * @param attestationId content hash of the blob
 * @param attestation decoded attestation
 * @since 0.3.0
 */
public record VerifiedAttestation(String blob, String attestationId, Attestation attestation) {

  public AttestationPayload payload() {
    return attestation.payload();
  }
}
