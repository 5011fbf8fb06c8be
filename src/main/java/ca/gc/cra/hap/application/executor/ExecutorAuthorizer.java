package ca.gc.cra.hap.application.executor;

import ca.gc.cra.hap.application.attestation.AttestationVerifier;
import ca.gc.cra.hap.application.attestation.VerifiedAttestation;
import ca.gc.cra.hap.application.canonical.FrameCanonicalizer;
import ca.gc.cra.hap.application.port.MetricsPort;
import ca.gc.cra.hap.application.scope.ScopeSatisfier;
import ca.gc.cra.hap.domain.attestation.AttestationPayload;
import ca.gc.cra.hap.domain.attestation.AttestedScope;
import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;
import ca.gc.cra.hap.domain.frame.Frame;
import ca.gc.cra.hap.domain.profile.Profile;
import ca.gc.cra.hap.domain.profile.ProfileRegistry;
import ca.gc.cra.hap.logging.Logs;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decides whether an executor may run a deployment.
 * <p><strong>Steps:</strong> verify the primary blob (signature, expiry), require the expected
 * profile, recompute the frame hash from the request parameters, then check that the scopes of
 * every verified attestation for that frame cover the execution path.</p>
 * <p><strong>Blindness:</strong> the executor only ever sees hashes, identifiers, and scopes.</p>
 * <p><strong>Observability:</strong> Increments {@code hap.authorize.granted} or
 * {@code hap.authorize.denied}.</p>
 *
 * @since 0.3.0
 */
public final class ExecutorAuthorizer {
  private static final Logger log = LoggerFactory.getLogger(ExecutorAuthorizer.class);
  private static final Comparator<AttestedScope> SCOPE_ORDER = Comparator
      .comparing(AttestedScope::domain)
      .thenComparing(AttestedScope::env)
      .thenComparing(scope -> scope.did() == null ? "" : scope.did());

  private final AttestationVerifier verifier;
  private final ProfileRegistry profiles;
  private final String expectedProfileId;
  private final MetricsPort metrics;

  /**
   * Creates an authorizer.
   *
   * @param verifier blob verifier
   * @param profiles known profiles
   * @param expectedProfileId profile the executor is pinned to, or {@code null} to accept the request's
   *     profile (or, when the request names none, the attested one)
   * @param metrics metrics sink
   */
  public ExecutorAuthorizer(
      AttestationVerifier verifier, ProfileRegistry profiles, String expectedProfileId, MetricsPort metrics) {
    this.verifier = Objects.requireNonNull(verifier, "verifier");
    this.profiles = Objects.requireNonNull(profiles, "profiles");
    this.expectedProfileId = expectedProfileId;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Authorizes a request.
   *
   * @param request executor request
   * @return decision describing what may run
   * @throws ProtocolException with a stable code when authorization is denied
   */
  public AuthorizationDecision authorize(ExecutionRequest request) {
    Objects.requireNonNull(request, "request");
    try {
      AuthorizationDecision decision = decide(request);
      metrics.increment("hap.authorize.granted");
      log.info("Authorized path={} frame={} scopes={}",
          decision.executionPath(), decision.frameHash(), decision.scopes().size());
      return decision;
    } catch (ProtocolException ex) {
      metrics.increment("hap.authorize.denied");
      log.info("Authorization denied code={} reason={}", ex.code(), ex.getMessage());
      throw ex;
    }
  }

  /**
   * Authorizes a request, reporting denial as a value.
   *
   * @param request executor request
   * @return granted or denied outcome
   */
  public AuthorizationOutcome evaluate(ExecutionRequest request) {
    try {
      return AuthorizationOutcome.granted(authorize(request));
    } catch (ProtocolException ex) {
      return AuthorizationOutcome.denied(ex.code(), ex.getMessage());
    }
  }

  private AuthorizationDecision decide(ExecutionRequest request) {
    VerifiedAttestation primary = verifier.verifySignatureAndExpiry(request.blob());
    AttestationPayload payload = primary.payload();

    String expected = expectedProfileId != null ? expectedProfileId : request.profileId();
    if (expected == null) {
      expected = payload.profileId();
    }
    if (!payload.profileId().equals(expected)) {
      throw new ProtocolException(ErrorCode.PROFILE_MISMATCH,
          "attestation profile " + payload.profileId() + " does not match expected " + expected);
    }
    if (request.profileId() != null && !request.profileId().equals(expected)) {
      throw new ProtocolException(ErrorCode.PROFILE_MISMATCH,
          "request profile " + request.profileId() + " does not match expected " + expected);
    }
    Profile profile = profiles.require(expected);
    profile.executionPath(request.executionPath());

    String frameHash = FrameCanonicalizer.frameHash(
        Frame.forVersion(profile.version(), request.repo(), request.sha(), request.env(), profile.id(),
            request.executionPath(), request.disclosureHash()),
        profile);
    if (!payload.frameHash().equals(frameHash)) {
      throw new ProtocolException(ErrorCode.FRAME_MISMATCH,
          "attested frame " + payload.frameHash() + " does not match recomputed " + frameHash);
    }

    TreeSet<AttestedScope> scopes = new TreeSet<>(SCOPE_ORDER);
    scopes.addAll(payload.scopes());
    long expiresAt = payload.expiresAt();
    for (String extra : request.additionalBlobs()) {
      AttestationPayload other = additional(extra, profile, frameHash);
      if (other != null) {
        scopes.addAll(other.scopes());
        expiresAt = Math.min(expiresAt, other.expiresAt());
      }
    }

    List<AttestedScope> resolved = new ArrayList<>(scopes);
    ScopeSatisfier.requireSatisfied(profile, request.executionPath(), resolved);
    return new AuthorizationDecision(
        primary.attestationId(),
        frameHash,
        profile.id(),
        request.executionPath(),
        resolved,
        payload.issuedAt(),
        expiresAt);
  }

  private AttestationPayload additional(String blob, Profile profile, String frameHash) {
    try {
      AttestationPayload other = verifier.verify(blob, frameHash).payload();
      if (!other.profileId().equals(profile.id())) {
        log.warn("Ignoring additional attestation for profile {}", other.profileId());
        return null;
      }
      return other;
    } catch (ProtocolException ex) {
      log.warn("Ignoring additional attestation code={} blob={}", ex.code(), Logs.truncate(blob, 24));
      return null;
    }
  }
}
