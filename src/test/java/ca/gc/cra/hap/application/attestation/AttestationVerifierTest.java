package ca.gc.cra.hap.application.attestation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.hap.domain.attestation.Attestation;
import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;
import ca.gc.cra.hap.domain.profile.DeployGateProfiles;
import ca.gc.cra.hap.fixtures.ProtocolFixtures;
import ca.gc.cra.hap.fixtures.RecordingMetricsPort;
import ca.gc.cra.hap.infrastructure.crypto.Ed25519Keys;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AttestationVerifierTest {
  private final ProtocolFixtures.Authority authority = new ProtocolFixtures.Authority();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private SignedAttestation signed;
  private String frameHash;

  @BeforeEach
  void setUp() {
    frameHash = ProtocolFixtures.v03FrameHash(DeployGateProfiles.CANARY);
    signed = authority.signer().sign(ProtocolFixtures.v03Request(DeployGateProfiles.CANARY, "engineering"));
  }

  @Test
  void validBlobVerifies() {
    VerifiedAttestation verified = authority.verifier(metrics).verify(signed.blob(), frameHash);

    assertEquals(signed.attestationId(), verified.attestationId());
    assertEquals(DeployGateProfiles.V03_ID, verified.payload().profileId());
    assertEquals(1, metrics.count("hap.verify.success"));
  }

  @Test
  void tamperedPayloadFailsSignature() {
    Attestation original = signed.attestation();
    String forgedPayload = original.payloadJson().replace("\"engineering\"", "\"security\"");
    Attestation forged = new Attestation(original.header(), original.payload(), original.signature(), forgedPayload);

    ProtocolException ex = assertThrows(ProtocolException.class,
        () -> authority.verifier(metrics).verify(authority.blobs().encode(forged), null));

    assertEquals(ErrorCode.INVALID_SIGNATURE, ex.code());
    assertEquals(1, metrics.count("hap.verify.failure.invalid_signature"));
  }

  @Test
  void flippedByteInBlobIsRejected() {
    String document = new String(Base64.getUrlDecoder().decode(signed.blob()), StandardCharsets.UTF_8);
    String flipped = document.replace("\"issued_at\":" + ProtocolFixtures.NOW,
        "\"issued_at\":" + (ProtocolFixtures.NOW - 1));
    String blob = Base64.getUrlEncoder().withoutPadding().encodeToString(flipped.getBytes(StandardCharsets.UTF_8));

    ProtocolException ex = assertThrows(ProtocolException.class, () -> authority.verifier().verify(blob, frameHash));

    assertEquals(ErrorCode.INVALID_SIGNATURE, ex.code());
  }

  @Test
  void expiryBoundaryIsExclusive() {
    long expiresAt = signed.attestation().payload().expiresAt();
    AttestationVerifier verifier = authority.verifier();

    authority.clock().set(expiresAt - 1);
    verifier.verify(signed.blob(), frameHash);

    authority.clock().set(expiresAt);
    ProtocolException ex = assertThrows(ProtocolException.class, () -> verifier.verify(signed.blob(), frameHash));
    assertEquals(ErrorCode.EXPIRED, ex.code());
  }

  @Test
  void frameMismatchIsReportedAfterSignature() {
    String otherFrame = ProtocolFixtures.v03FrameHash(DeployGateProfiles.FULL);

    ProtocolException ex = assertThrows(ProtocolException.class,
        () -> authority.verifier().verify(signed.blob(), otherFrame));

    assertEquals(ErrorCode.FRAME_MISMATCH, ex.code());
  }

  @Test
  void unknownKidAndForeignKeyFail() {
    ProtocolFixtures.Authority other = new ProtocolFixtures.Authority();

    ProtocolException foreign = assertThrows(ProtocolException.class,
        () -> authority.verifier().verify(signed.blob(), Ed25519Keys.generate().getPublic(), frameHash));
    assertEquals(ErrorCode.INVALID_SIGNATURE, foreign.code());

    ProtocolException wrongKey = assertThrows(ProtocolException.class,
        () -> other.verifier().verify(signed.blob(), frameHash));
    assertEquals(ErrorCode.INVALID_SIGNATURE, wrongKey.code());
  }

  @Test
  void explicitKeyVerifies() {
    VerifiedAttestation verified = authority.verifier()
        .verify(signed.blob(), authority.pair().getPublic(), frameHash);

    assertEquals(signed.attestationId(), verified.attestationId());
  }

  @Test
  void malformedBlobCountsAsMalformed() {
    ProtocolException ex = assertThrows(ProtocolException.class,
        () -> authority.verifier(metrics).verifySignatureAndExpiry("%%%"));

    assertEquals(ErrorCode.MALFORMED_ATTESTATION, ex.code());
    assertEquals(1, metrics.count("hap.verify.failure.malformed_attestation"));
  }
}
