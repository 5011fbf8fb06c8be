package ca.gc.cra.hap.application.attestation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hap.domain.attestation.AttestationBlock;
import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AttestationTextCodecTest {
  private final AttestationTextCodec codec = new AttestationTextCodec();

  private static final AttestationBlock V03 = new AttestationBlock(
      ProtocolVersion.V0_3, "deploy-gate@0.3", "engineering", "prod", "deploy-prod-canary",
      "0123456789abcdef0123456789abcdef01234567", "sha256:aa", "sha256:bb", "eyJibG9iIjp0cnVlfQ");

  @Test
  void encodesKeysInFixedOrder() {
    String expected = """
        ---BEGIN HAP_ATTESTATION v=1---
        profile=deploy-gate@0.3
        domain=engineering
        env=prod
        path=deploy-prod-canary
        sha=0123456789abcdef0123456789abcdef01234567
        frame_hash=sha256:aa
        domain_disclosure_hash=sha256:bb
        blob=eyJibG9iIjp0cnVlfQ
        ---END HAP_ATTESTATION---""";

    assertEquals(expected, codec.encode(V03));
  }

  @Test
  void v02BlockUsesRoleKey() {
    AttestationBlock v02 = new AttestationBlock(
        ProtocolVersion.V0_2, "deploy-gate@0.2", "engineering", "prod", "deploy-prod-full",
        "0123456789abcdef0123456789abcdef01234567", "sha256:aa", "sha256:cc", "blob");

    String text = codec.encode(v02);

    assertTrue(text.contains("\nrole=engineering\n"));
    assertTrue(text.contains("\ndisclosure_hash=sha256:cc\n"));
    assertEquals(Optional.of(v02), codec.decode(text));
  }

  @Test
  void decodesBlockSurroundedByProse() {
    String comment = "Approving the canary.\n\n" + codec.encode(V03) + "\n\nThanks!";

    assertEquals(Optional.of(V03), codec.decode(comment));
  }

  @Test
  void toleratesCarriageReturnsAndBlankLines() {
    String comment = codec.encode(V03).replace("\n", "\r\n").replace("env=prod", "\r\nenv=prod");

    assertEquals(Optional.of(V03), codec.decode(comment));
  }

  @Test
  void rejectsDuplicateMissingAndUnterminated() {
    String encoded = codec.encode(V03);

    assertTrue(codec.decode(encoded.replace("env=prod", "env=prod\nenv=staging")).isEmpty());
    assertTrue(codec.decode(encoded.replace("sha=0123456789abcdef0123456789abcdef01234567\n", "")).isEmpty());
    assertTrue(codec.decode(encoded.replace(AttestationTextCodec.END, "")).isEmpty());
    assertTrue(codec.decode(encoded.replace("env=prod", "env prod")).isEmpty());
    assertTrue(codec.decode("no block here").isEmpty());
    assertTrue(codec.decode(null).isEmpty());
  }

  @Test
  void stopsAtFirstEndMarker() {
    String comment = codec.encode(V03) + "\nblob=injected\n" + AttestationTextCodec.END;

    assertEquals("eyJibG9iIjp0cnVlfQ", codec.decode(comment).orElseThrow().blob());
  }

  @Test
  void decodeAllSkipsInvalidComments() {
    List<AttestationBlock> blocks = codec.decodeAll(List.of("lgtm", codec.encode(V03), "nope"));

    assertEquals(List.of(V03), blocks);
  }
}
