package ca.gc.cra.hap.application.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hap.application.attestation.AttestationRequest;
import ca.gc.cra.hap.application.attestation.SignedAttestation;
import ca.gc.cra.hap.domain.attestation.AttestedScope;
import ca.gc.cra.hap.domain.attestation.DecisionOwnerScope;
import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;
import ca.gc.cra.hap.domain.profile.DeployGateProfiles;
import ca.gc.cra.hap.domain.profile.ProfileRegistry;
import ca.gc.cra.hap.fixtures.ProtocolFixtures;
import ca.gc.cra.hap.fixtures.RecordingMetricsPort;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExecutorAuthorizerTest {
  private final ProtocolFixtures.Authority authority = new ProtocolFixtures.Authority();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  private ExecutorAuthorizer authorizer(String expectedProfile) {
    return new ExecutorAuthorizer(authority.verifier(), ProfileRegistry.defaults(), expectedProfile, metrics);
  }

  private static ExecutionRequest request(String blob, String path, List<String> additional) {
    return new ExecutionRequest(blob, ProtocolFixtures.REPO, ProtocolFixtures.SHA, ProtocolFixtures.ENV,
        DeployGateProfiles.V03_ID, path, null, additional);
  }

  private String sign(String path, String domain) {
    return authority.signer().sign(ProtocolFixtures.v03Request(path, domain)).blob();
  }

  @Test
  void canaryIsAuthorizedByEngineeringAlone() {
    SignedAttestation signed = authority.signer().sign(
        ProtocolFixtures.v03Request(DeployGateProfiles.CANARY, "engineering"));

    AuthorizationDecision decision = authorizer(DeployGateProfiles.V03_ID)
        .authorize(request(signed.blob(), DeployGateProfiles.CANARY, List.of()));

    assertEquals(signed.attestationId(), decision.attestationId());
    assertEquals(ProtocolFixtures.v03FrameHash(DeployGateProfiles.CANARY), decision.frameHash());
    assertEquals(List.of(new AttestedScope("engineering", "prod", ProtocolFixtures.OWNER)), decision.scopes());
    assertEquals(1, metrics.count("hap.authorize.granted"));
  }

  @Test
  void fullPathCombinesAdditionalAttestations() {
    String engineering = sign(DeployGateProfiles.FULL, "engineering");
    authority.clock().set(ProtocolFixtures.NOW + 100);
    String release = sign(DeployGateProfiles.FULL, "release_management");

    AuthorizationDecision decision = authorizer(null)
        .authorize(request(engineering, DeployGateProfiles.FULL, List.of(release)));

    assertEquals(2, decision.scopes().size());
    assertEquals("engineering", decision.scopes().get(0).domain());
    assertEquals("release_management", decision.scopes().get(1).domain());
    assertEquals(ProtocolFixtures.NOW + 3600, decision.expiresAt());
  }

  @Test
  void missingDomainIsScopeInsufficient() {
    String engineering = sign(DeployGateProfiles.FULL, "engineering");

    AuthorizationOutcome outcome = authorizer(null)
        .evaluate(request(engineering, DeployGateProfiles.FULL, List.of()));

    assertFalse(outcome.authorized());
    assertEquals(ErrorCode.SCOPE_INSUFFICIENT, outcome.error());
    assertTrue(outcome.reason().contains("release_management"));
    assertEquals(1, metrics.count("hap.authorize.denied"));
  }

  @Test
  void badAdditionalBlobIsSkipped() {
    String engineering = sign(DeployGateProfiles.FULL, "engineering");
    String otherFrame = sign(DeployGateProfiles.CANARY, "engineering");

    AuthorizationOutcome outcome = authorizer(null)
        .evaluate(request(engineering, DeployGateProfiles.FULL, List.of("garbage", otherFrame)));

    assertEquals(ErrorCode.SCOPE_INSUFFICIENT, outcome.error());
  }

  @Test
  void requestForDifferentCommitIsFrameMismatch() {
    String blob = sign(DeployGateProfiles.CANARY, "engineering");
    ExecutionRequest other = new ExecutionRequest(blob, ProtocolFixtures.REPO, ProtocolFixtures.OTHER_SHA,
        ProtocolFixtures.ENV, DeployGateProfiles.V03_ID, DeployGateProfiles.CANARY, null, List.of());

    ProtocolException ex = assertThrows(ProtocolException.class, () -> authorizer(null).authorize(other));

    assertEquals(ErrorCode.FRAME_MISMATCH, ex.code());
  }

  @Test
  void pathOtherThanAttestedIsFrameMismatch() {
    String blob = sign(DeployGateProfiles.CANARY, "engineering");

    AuthorizationOutcome outcome = authorizer(null)
        .evaluate(request(blob, DeployGateProfiles.FULL, List.of()));

    assertEquals(ErrorCode.FRAME_MISMATCH, outcome.error());
  }

  @Test
  void pinnedProfileRejectsOtherGeneration() {
    String blob = sign(DeployGateProfiles.CANARY, "engineering");

    ProtocolException ex = assertThrows(ProtocolException.class,
        () -> authorizer(DeployGateProfiles.V02_ID).authorize(request(blob, DeployGateProfiles.CANARY, List.of())));

    assertEquals(ErrorCode.PROFILE_MISMATCH, ex.code());
  }

  @Test
  void profileFallsBackToAttestedOne() {
    String blob = sign(DeployGateProfiles.CANARY, "engineering");
    ExecutionRequest unnamed = new ExecutionRequest(blob, ProtocolFixtures.REPO, ProtocolFixtures.SHA,
        ProtocolFixtures.ENV, null, DeployGateProfiles.CANARY, null, List.of());

    assertEquals(DeployGateProfiles.V03_ID, authorizer(null).authorize(unnamed).profileId());
  }

  @Test
  void expiredPrimaryIsDenied() {
    String blob = sign(DeployGateProfiles.CANARY, "engineering");
    authority.clock().set(ProtocolFixtures.NOW + 3600);

    AuthorizationOutcome outcome = authorizer(null).evaluate(request(blob, DeployGateProfiles.CANARY, List.of()));

    assertEquals(ErrorCode.EXPIRED, outcome.error());
  }

  @Test
  void v02FrameBindsDisclosureHash() {
    String blob = authority.signer().sign(ProtocolFixtures.v02Request(DeployGateProfiles.CANARY,
        List.of(new DecisionOwnerScope(
            ProtocolFixtures.OWNER, "engineering", "prod"))))
        .blob();
    ExecutionRequest matching = new ExecutionRequest(blob, ProtocolFixtures.REPO, ProtocolFixtures.SHA,
        ProtocolFixtures.ENV, DeployGateProfiles.V02_ID, DeployGateProfiles.CANARY,
        ProtocolFixtures.DISCLOSURE_HASH, List.of());
    ExecutionRequest altered = new ExecutionRequest(blob, ProtocolFixtures.REPO, ProtocolFixtures.SHA,
        ProtocolFixtures.ENV, DeployGateProfiles.V02_ID, DeployGateProfiles.CANARY,
        "sha256:" + "0".repeat(64), List.of());

    assertTrue(authorizer(null).evaluate(matching).authorized());
    assertEquals(ErrorCode.FRAME_MISMATCH, authorizer(null).evaluate(altered).error());
  }

  @Test
  void ttlFromRequestIsHonoured() {
    String blob = authority.signer().sign(new AttestationRequest.V03(
        DeployGateProfiles.V03_ID, DeployGateProfiles.CANARY, ProtocolFixtures.v03FrameHash(DeployGateProfiles.CANARY),
        "engineering", ProtocolFixtures.OWNER, "prod", ProtocolFixtures.DISCLOSURE_HASH, 60L)).blob();

    AuthorizationDecision decision = authorizer(null).authorize(request(blob, DeployGateProfiles.CANARY, List.of()));

    assertEquals(ProtocolFixtures.NOW + 60, decision.expiresAt());
  }
}
