package ca.gc.cra.hap.application.attestation;

import ca.gc.cra.hap.domain.attestation.Attestation;

/**
 * Result of signing: the blob, its decoded form, and the blob hash executors use as identifier.
 *
 * @param blob URL-safe base64 blob
 * @param attestation signed attestation
 * @param attestationId content hash of {@code blob}
 * @since 0.3.0
 */
public record SignedAttestation(String blob, Attestation attestation, String attestationId) {}
