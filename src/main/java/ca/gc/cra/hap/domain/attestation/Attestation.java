package ca.gc.cra.hap.domain.attestation;

import java.util.Objects;

/**
 * Decoded attestation. {@code payloadJson} is the exact serialized payload the signature covers;
 * verification always uses these bytes rather than a re-serialization of {@code payload}.
 *
 * @param header blob header
 * @param payload parsed payload
 * @param signature standard base64 Ed25519 signature
 * @param payloadJson compact payload JSON that was signed
 * @since 0.3.0
 */
public record Attestation(
    AttestationHeader header, AttestationPayload payload, String signature, String payloadJson) {

  public Attestation {
    Objects.requireNonNull(header, "header");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(signature, "signature");
    Objects.requireNonNull(payloadJson, "payloadJson");
  }
}
