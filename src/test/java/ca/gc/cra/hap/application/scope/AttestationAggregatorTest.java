package ca.gc.cra.hap.application.scope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hap.application.attestation.AttestationRequest;
import ca.gc.cra.hap.application.attestation.AttestationTextCodec;
import ca.gc.cra.hap.application.canonical.FrameCanonicalizer;
import ca.gc.cra.hap.domain.attestation.AttestationBlock;
import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;
import ca.gc.cra.hap.domain.frame.Frame;
import ca.gc.cra.hap.domain.profile.DeployGateProfiles;
import ca.gc.cra.hap.domain.profile.Profile;
import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import ca.gc.cra.hap.fixtures.ProtocolFixtures;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AttestationAggregatorTest {
  private final ProtocolFixtures.Authority authority = new ProtocolFixtures.Authority();
  private final AttestationTextCodec textCodec = new AttestationTextCodec();
  private final Profile v03 = ProtocolFixtures.v03();
  private final String fullFrame = ProtocolFixtures.v03FrameHash(DeployGateProfiles.FULL);
  private final Frame frame = Frame.v03(ProtocolFixtures.REPO, ProtocolFixtures.SHA, ProtocolFixtures.ENV,
      DeployGateProfiles.V03_ID, DeployGateProfiles.FULL);

  private String comment(String domain, String sha, String path, String frameHash, String blob) {
    return "Approved.\n" + textCodec.encode(new AttestationBlock(ProtocolVersion.V0_3, DeployGateProfiles.V03_ID,
        domain, "prod", path, sha, frameHash, ProtocolFixtures.DISCLOSURE_HASH, blob));
  }

  private String signedComment(String domain) {
    String blob = authority.signer().sign(ProtocolFixtures.v03Request(DeployGateProfiles.FULL, domain)).blob();
    return comment(domain, ProtocolFixtures.SHA, DeployGateProfiles.FULL, fullFrame, blob);
  }

  @Test
  void verifiedBlocksCoverFullPath() {
    AttestationAggregator aggregator = new AttestationAggregator(textCodec, authority.verifier());

    AggregatedCoverage coverage = aggregator.aggregate(frame, v03,
        List.of("lgtm", signedComment("engineering"), signedComment("release_management")));

    assertTrue(coverage.satisfied());
    assertEquals(Set.of("engineering", "release_management"), coverage.domains());
    assertEquals(fullFrame, coverage.frameHash());
    assertEquals(Set.of(fullFrame), coverage.frameHashes());
    assertEquals(2, coverage.accepted().size());
    assertEquals(0, coverage.rejected());
  }

  @Test
  void resultDoesNotDependOnCommentOrder() {
    AttestationAggregator aggregator = new AttestationAggregator(textCodec, authority.verifier());
    List<String> comments = new ArrayList<>(List.of(
        signedComment("engineering"), signedComment("security"), "noise"));

    AggregatedCoverage forward = aggregator.aggregate(frame, v03, comments);
    Collections.reverse(comments);
    AggregatedCoverage backward = aggregator.aggregate(frame, v03, comments);

    assertEquals(forward, backward);
    assertTrue(forward.satisfied());
    assertEquals("security", forward.coverage().substitutions().get(0).substitute());
  }

  @Test
  void blocksForOtherCommitsOrFramesAreIgnored() {
    AttestationAggregator aggregator = new AttestationAggregator(textCodec, null);

    AggregatedCoverage coverage = aggregator.aggregate(frame, v03,
        List.of(
            comment("engineering", ProtocolFixtures.SHA, DeployGateProfiles.FULL, fullFrame, "x"),
            comment("release_management", ProtocolFixtures.OTHER_SHA, DeployGateProfiles.FULL, fullFrame, "y"),
            comment("release_management", ProtocolFixtures.SHA, DeployGateProfiles.FULL, "sha256:other", "z")));

    assertFalse(coverage.satisfied());
    assertEquals(Set.of("engineering"), coverage.domains());
    assertEquals(Set.of(fullFrame, "sha256:other"), coverage.frameHashes());
    assertEquals(2, coverage.rejected());
  }

  @Test
  void unverifiedBlobsDoNotCountWhenVerifying() {
    AttestationAggregator verifying = new AttestationAggregator(textCodec, authority.verifier());
    AttestationAggregator trusting = new AttestationAggregator(textCodec, null);
    List<String> comments = List.of(
        signedComment("engineering"),
        comment("release_management", ProtocolFixtures.SHA, DeployGateProfiles.FULL, fullFrame, "forged"));

    assertFalse(verifying.aggregate(frame, v03, comments).satisfied());
    assertTrue(trusting.aggregate(frame, v03, comments).satisfied());
  }

  @Test
  void verifiedScopesComeFromPayloadNotPlaintext() {
    AttestationAggregator aggregator = new AttestationAggregator(textCodec, authority.verifier());
    String engineeringBlob = authority.signer()
        .sign(ProtocolFixtures.v03Request(DeployGateProfiles.FULL, "engineering")).blob();

    AggregatedCoverage coverage = aggregator.aggregate(frame, v03,
        List.of(comment("release_management", ProtocolFixtures.SHA, DeployGateProfiles.FULL, fullFrame, engineeringBlob)));

    assertEquals(Set.of("engineering"), coverage.domains());
    assertFalse(coverage.satisfied());
  }

  @Test
  void blobSignedForAnotherCommitDoesNotCountUnderThisCommitsLabel() {
    AttestationAggregator aggregator = new AttestationAggregator(textCodec, authority.verifier());
    String otherFrame = FrameCanonicalizer.frameHash(Frame.v03(ProtocolFixtures.REPO, ProtocolFixtures.OTHER_SHA,
        ProtocolFixtures.ENV, DeployGateProfiles.V03_ID, DeployGateProfiles.FULL), v03);
    String replayed = authority.signer().sign(new AttestationRequest.V03(DeployGateProfiles.V03_ID,
        DeployGateProfiles.FULL, otherFrame, "release_management", ProtocolFixtures.OWNER, ProtocolFixtures.ENV,
        ProtocolFixtures.DISCLOSURE_HASH, null)).blob();

    AggregatedCoverage coverage = aggregator.aggregate(frame, v03, List.of(
        signedComment("engineering"),
        comment("release_management", ProtocolFixtures.SHA, DeployGateProfiles.FULL, fullFrame, replayed),
        comment("release_management", ProtocolFixtures.SHA, DeployGateProfiles.FULL, otherFrame, replayed)));

    assertFalse(coverage.satisfied());
    assertEquals(Set.of("engineering"), coverage.domains());
    assertEquals(2, coverage.rejected());
    assertEquals(1, coverage.accepted().size());
    assertEquals(fullFrame, coverage.accepted().get(0).frameHash());
  }

  @Test
  void unknownExecutionPathIsRejected() {
    AttestationAggregator aggregator = new AttestationAggregator(textCodec, null);
    Frame unknown = Frame.v03(ProtocolFixtures.REPO, ProtocolFixtures.SHA, ProtocolFixtures.ENV,
        DeployGateProfiles.V03_ID, "deploy-nowhere");

    ProtocolException ex = assertThrows(ProtocolException.class,
        () -> aggregator.aggregate(unknown, v03, List.of(signedComment("engineering"))));

    assertEquals(ErrorCode.UNKNOWN_EXECUTION_PATH, ex.code());
  }
}
