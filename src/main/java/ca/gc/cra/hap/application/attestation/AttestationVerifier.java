package ca.gc.cra.hap.application.attestation;

import ca.gc.cra.hap.application.port.ClockPort;
import ca.gc.cra.hap.application.port.MetricsPort;
import ca.gc.cra.hap.application.port.PublicKeyDirectory;
import ca.gc.cra.hap.domain.attestation.Attestation;
import ca.gc.cra.hap.domain.attestation.AttestationPayload;
import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;
import ca.gc.cra.hap.logging.Logs;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Verifies attestation blobs.
 * <p><strong>Steps:</strong> decode, signature, expiry, frame hash. Each step is public so callers and
 * tests can run it alone; {@link #verify(String, String)} runs them in order and stops at the first
 * failure.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe when its ports are.</p>
 * <p><strong>Observability:</strong> Increments {@code hap.verify.success} or
 * {@code hap.verify.failure.<code>}.</p>
 *
 * @since 0.3.0
 */
public final class AttestationVerifier {
  private static final Logger log = LoggerFactory.getLogger(AttestationVerifier.class);

  private final AttestationBlobCodec blobs;
  private final PublicKeyDirectory keys;
  private final ClockPort clock;
  private final MetricsPort metrics;

  public AttestationVerifier(
      AttestationBlobCodec blobs, PublicKeyDirectory keys, ClockPort clock, MetricsPort metrics) {
    this.blobs = Objects.requireNonNull(blobs, "blobs");
    this.keys = Objects.requireNonNull(keys, "keys");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Decodes a blob.
   *
   * @param blob blob text
   * @return decoded attestation
   * @throws ProtocolException {@link ErrorCode#MALFORMED_ATTESTATION}
   */
  public Attestation decode(String blob) {
    return blobs.decode(blob);
  }

  /**
   * Verifies the signature with the key registered for the header {@code kid}.
   *
   * @param attestation decoded attestation
   * @throws ProtocolException {@link ErrorCode#INVALID_SIGNATURE} when the kid is unknown or the check fails
   */
  public void verifySignature(Attestation attestation) {
    String kid = attestation.header().kid();
    PublicKey key = keys.find(kid).orElseThrow(
        () -> new ProtocolException(ErrorCode.INVALID_SIGNATURE, "unknown signing key " + kid));
    verifySignature(attestation, key);
  }

  /**
   * Verifies the signature over the exact payload text with an explicit key.
   *
   * @param attestation decoded attestation
   * @param publicKey Ed25519 public key
   * @throws ProtocolException {@link ErrorCode#INVALID_SIGNATURE}
   */
  public void verifySignature(Attestation attestation, PublicKey publicKey) {
    boolean valid;
    try {
      valid = Ed25519Signatures.verify(publicKey, attestation.payloadJson(), attestation.signature());
    } catch (GeneralSecurityException | IllegalArgumentException ex) {
      throw new ProtocolException(ErrorCode.INVALID_SIGNATURE, "signature could not be checked", ex);
    }
    if (!valid) {
      throw new ProtocolException(ErrorCode.INVALID_SIGNATURE, "signature does not match payload");
    }
  }

  /**
   * Fails when the payload has expired. An attestation expiring exactly now is expired.
   *
   * @param payload payload to check
   * @param nowSeconds current epoch seconds
   * @throws ProtocolException {@link ErrorCode#EXPIRED}
   */
  public static void checkExpiry(AttestationPayload payload, long nowSeconds) {
    if (payload.expiresAt() <= nowSeconds) {
      throw new ProtocolException(
          ErrorCode.EXPIRED, "attestation expired at " + payload.expiresAt() + " (now " + nowSeconds + ")");
    }
  }

  /**
   * Fails when the attested frame hash differs from the expected one.
   *
   * @param attestation decoded attestation
   * @param expectedFrameHash frame hash recomputed by the caller
   * @throws ProtocolException {@link ErrorCode#FRAME_MISMATCH}
   */
  public static void verifyFrameHash(Attestation attestation, String expectedFrameHash) {
    String actual = attestation.payload().frameHash();
    if (!actual.equals(expectedFrameHash)) {
      throw new ProtocolException(
          ErrorCode.FRAME_MISMATCH, "frame hash " + actual + " does not match expected " + expectedFrameHash);
    }
  }

  /**
   * Runs decode, signature, and expiry checks.
   *
   * @param blob blob text
   * @return verified attestation
   * @throws ProtocolException with the code of the first failing step
   */
  public VerifiedAttestation verifySignatureAndExpiry(String blob) {
    return run(blob, null, null);
  }

  /**
   * Runs every step, resolving the key from the header {@code kid}.
   *
   * @param blob blob text
   * @param expectedFrameHash frame hash to match, or {@code null} to skip the frame step
   * @return verified attestation
   * @throws ProtocolException with the code of the first failing step
   */
  public VerifiedAttestation verify(String blob, String expectedFrameHash) {
    return run(blob, null, expectedFrameHash);
  }

  /**
   * Runs every step with an explicit key, ignoring the header {@code kid}.
   *
   * @param blob blob text
   * @param publicKey Ed25519 public key
   * @param expectedFrameHash frame hash to match, or {@code null} to skip the frame step
   * @return verified attestation
   * @throws ProtocolException with the code of the first failing step
   */
  public VerifiedAttestation verify(String blob, PublicKey publicKey, String expectedFrameHash) {
    return run(blob, Objects.requireNonNull(publicKey, "publicKey"), expectedFrameHash);
  }

  private VerifiedAttestation run(String blob, PublicKey publicKey, String expectedFrameHash) {
    try {
      Attestation attestation = decode(blob);
      if (publicKey == null) {
        verifySignature(attestation);
      } else {
        verifySignature(attestation, publicKey);
      }
      checkExpiry(attestation.payload(), clock.nowSeconds());
      if (expectedFrameHash != null) {
        verifyFrameHash(attestation, expectedFrameHash);
      }
      metrics.increment("hap.verify.success");
      return new VerifiedAttestation(blob, AttestationBlobCodec.attestationId(blob), attestation);
    } catch (ProtocolException ex) {
      metrics.increment("hap.verify.failure." + ex.code().wireName());
      log.info("Attestation rejected code={} blob={}", ex.code(), Logs.truncate(blob, 24));
      throw ex;
    }
  }
}
