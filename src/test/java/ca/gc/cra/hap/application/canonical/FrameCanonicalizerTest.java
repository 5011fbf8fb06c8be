package ca.gc.cra.hap.application.canonical;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ValidationException;
import ca.gc.cra.hap.domain.frame.Frame;
import ca.gc.cra.hap.fixtures.ProtocolFixtures;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FrameCanonicalizerTest {
  private static final String SHA = ProtocolFixtures.SHA;
  private static final String DISCLOSURE = ProtocolFixtures.DISCLOSURE_HASH;

  @Test
  void v02FrameRendersSixLinesInProfileOrder() {
    Frame frame = Frame.v02("acme/app", SHA, "prod", "deploy-gate@0.2", "deploy-prod-canary", DISCLOSURE);

    String canonical = FrameCanonicalizer.canonicalize(frame, ProtocolFixtures.v02());

    assertEquals(String.join("\n",
        "repo=acme/app",
        "sha=" + SHA,
        "env=prod",
        "profile=deploy-gate@0.2",
        "path=deploy-prod-canary",
        "disclosure_hash=" + DISCLOSURE), canonical);
    assertEquals(ContentHasher.hash(canonical), FrameCanonicalizer.frameHash(frame, ProtocolFixtures.v02()));
  }

  @Test
  void frameHashesArePinned() {
    Frame v02 = Frame.v02("acme/app", "0123456789abcdef0123456789abcdef01234567", "prod", "deploy-gate@0.2",
        "deploy-prod-canary", "sha256:8187135faead318892553b6d7ee48321c4d00ac028e88d17a02f05de9162863f");
    Frame v03 = Frame.v03("acme/app", "0123456789abcdef0123456789abcdef01234567", "prod", "deploy-gate@0.3",
        "deploy-prod-full");

    assertEquals("sha256:7b4f3ba3ab4072b0140ff2ec6320d0dbde8c952b367c33b3981f01327de21f5f",
        FrameCanonicalizer.frameHash(v02, ProtocolFixtures.v02()));
    assertEquals("sha256:7ca3d4b681fe6320e63366ead77f2d8f17d24452717af0db48ab8d0b0c5bfcfa",
        FrameCanonicalizer.frameHash(v03, ProtocolFixtures.v03()));
  }

  @Test
  void insertionOrderDoesNotAffectHash() {
    Map<String, String> reversed = new LinkedHashMap<>();
    reversed.put("path", "deploy-prod-full");
    reversed.put("profile", "deploy-gate@0.3");
    reversed.put("env", "prod");
    reversed.put("sha", SHA);
    reversed.put("repo", "acme/app");

    String expected = FrameCanonicalizer.frameHash(
        Frame.v03("acme/app", SHA, "prod", "deploy-gate@0.3", "deploy-prod-full"), ProtocolFixtures.v03());

    assertEquals(expected, FrameCanonicalizer.frameHash(new Frame(reversed), ProtocolFixtures.v03()));
  }

  @Test
  void v03FrameHasNoTrailingNewline() {
    String canonical = FrameCanonicalizer.canonicalize(
        Frame.v03("acme/app", SHA, "staging", "deploy-gate@0.3", "deploy-prod-canary"), ProtocolFixtures.v03());

    assertEquals(5, canonical.split("\n").length);
    assertTrue(canonical.endsWith("path=deploy-prod-canary"));
  }

  @Test
  void everyViolationIsReported() {
    Frame frame = Frame.v02("Acme/App", "abc", "dev", "deploy-gate@0.2", "deploy-prod-canary", "md5:1");

    ValidationException ex = assertThrows(ValidationException.class,
        () -> FrameCanonicalizer.canonicalize(frame, ProtocolFixtures.v02()));

    assertEquals(ErrorCode.VALIDATION_ERROR, ex.code());
    assertEquals(4, ex.violations().size());
  }

  @Test
  void missingAndUnknownFieldsAreRejected() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("repo", "acme/app");
    fields.put("sha", SHA);
    fields.put("env", "prod");
    fields.put("profile", "deploy-gate@0.3");
    fields.put("extra", "x");

    List<String> violations = FrameCanonicalizer.validate(new Frame(fields), ProtocolFixtures.v03());

    assertTrue(violations.contains("unknown field: extra"));
    assertTrue(violations.contains("missing required field: path"));
  }

  @Test
  void profileFieldMustNameTheGoverningProfile() {
    Frame frame = Frame.v03("acme/app", SHA, "prod", "deploy-gate@0.2", "deploy-prod-canary");

    List<String> violations = FrameCanonicalizer.validate(frame, ProtocolFixtures.v03());

    assertEquals(1, violations.size());
    assertTrue(violations.get(0).contains("does not match profile deploy-gate@0.3"));
  }

  @Test
  void differentPathsHashDifferently() {
    assertNotEquals(
        ProtocolFixtures.v03FrameHash("deploy-prod-canary"),
        ProtocolFixtures.v03FrameHash("deploy-prod-full"));
  }
}
