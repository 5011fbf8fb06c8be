package ca.gc.cra.hap.application.attestation;

import ca.gc.cra.hap.application.canonical.ContentHasher;
import ca.gc.cra.hap.application.port.ClockPort;
import ca.gc.cra.hap.application.port.MetricsPort;
import ca.gc.cra.hap.application.port.SigningKey;
import ca.gc.cra.hap.application.port.SigningKeyProvider;
import ca.gc.cra.hap.application.scope.ScopeSatisfier;
import ca.gc.cra.hap.domain.attestation.Attestation;
import ca.gc.cra.hap.domain.attestation.AttestationHeader;
import ca.gc.cra.hap.domain.attestation.AttestationPayload;
import ca.gc.cra.hap.domain.attestation.AttestationPayloadV02;
import ca.gc.cra.hap.domain.attestation.AttestationPayloadV03;
import ca.gc.cra.hap.domain.attestation.AttestedScope;
import ca.gc.cra.hap.domain.attestation.DecisionOwnerScope;
import ca.gc.cra.hap.domain.attestation.ResolvedDomain;
import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;
import ca.gc.cra.hap.domain.error.ValidationException;
import ca.gc.cra.hap.domain.profile.ExecutionPath;
import ca.gc.cra.hap.domain.profile.Profile;
import ca.gc.cra.hap.domain.profile.ProfileRegistry;
import ca.gc.cra.hap.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Signing authority that turns a validated request into a signed blob.
 * <p><strong>Checks, in order:</strong> profile known, request version matches the profile, execution
 * path known, field formats, required gates (v0.2), decision-owner scope coverage (v0.2), TTL.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe when its ports are.</p>
 * <p><strong>Observability:</strong> Increments {@code hap.sign.success} or {@code hap.sign.failure}.</p>
 *
 * @since 0.3.0
 */
public final class AttestationSigner {
  private static final Logger log = LoggerFactory.getLogger(AttestationSigner.class);

  private final ProfileRegistry profiles;
  private final SigningKeyProvider keys;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final AttestationBlobCodec blobs;
  private final Supplier<String> idGenerator;

  public AttestationSigner(
      ProfileRegistry profiles,
      SigningKeyProvider keys,
      ClockPort clock,
      MetricsPort metrics,
      AttestationBlobCodec blobs) {
    this(profiles, keys, clock, metrics, blobs, () -> UUID.randomUUID().toString());
  }

  AttestationSigner(
      ProfileRegistry profiles,
      SigningKeyProvider keys,
      ClockPort clock,
      MetricsPort metrics,
      AttestationBlobCodec blobs,
      Supplier<String> idGenerator) {
    this.profiles = Objects.requireNonNull(profiles, "profiles");
    this.keys = Objects.requireNonNull(keys, "keys");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.blobs = Objects.requireNonNull(blobs, "blobs");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
  }

  /**
   * Validates and signs a request.
   *
   * @param request v0.2 or v0.3 request
   * @return signed blob and its identifier
   * @throws ProtocolException with the code of the first failing check
   */
  public SignedAttestation sign(AttestationRequest request) {
    Objects.requireNonNull(request, "request");
    try {
      SignedAttestation signed = doSign(request);
      metrics.increment("hap.sign.success");
      log.info("Signed attestation profile={} path={} frame={} id={}",
          request.profileId(), request.executionPath(), request.frameHash(),
          signed.attestation().payload().attestationId());
      return signed;
    } catch (ProtocolException ex) {
      metrics.increment("hap.sign.failure");
      log.warn("Attestation request rejected code={} reason={}", ex.code(), ex.getMessage());
      throw ex;
    }
  }

  private SignedAttestation doSign(AttestationRequest request) {
    Profile profile = profiles.require(request.profileId());
    if (profile.version() != request.version()) {
      throw new ValidationException("attestation request", List.of(
          "request version " + request.version() + " does not match profile " + profile.id()));
    }
    ExecutionPath path = profile.executionPath(request.executionPath());

    List<String> violations = new ArrayList<>();
    if (!ContentHasher.isContentHash(request.frameHash())) {
      violations.add("frame_hash must be sha256:<64 hex>");
    }
    if (request instanceof AttestationRequest.V03 v03) {
      validateV03(v03, profile, path, violations);
    } else if (request instanceof AttestationRequest.V02 v02) {
      validateV02Format(v02, violations);
    }
    if (!violations.isEmpty()) {
      throw new ValidationException("attestation request", violations);
    }
    if (request instanceof AttestationRequest.V02 v02) {
      List<String> missingGates = new ArrayList<>();
      for (String gate : profile.requiredGates()) {
        if (!v02.resolvedGates().contains(gate)) {
          missingGates.add(gate);
        }
      }
      if (!missingGates.isEmpty()) {
        throw new ValidationException(ErrorCode.MISSING_GATES, "attestation request",
            List.of("missing gates " + missingGates));
      }
      ScopeSatisfier.requireSatisfied(profile, path.id(),
          v02.decisionOwnerScopes().stream()
              .map(scope -> new AttestedScope(scope.domain(), scope.env(), scope.did()))
              .toList());
    }

    long ttl = profile.ttl().resolve(request.ttlSeconds());
    long issuedAt = clock.nowSeconds();
    long expiresAt = issuedAt + ttl;
    String attestationId = idGenerator.get();

    AttestationPayload payload;
    if (request instanceof AttestationRequest.V02 v02) {
      payload = new AttestationPayloadV02(
          attestationId, profile.id(), request.frameHash(),
          v02.resolvedGates(), v02.decisionOwners(), v02.decisionOwnerScopes(),
          issuedAt, expiresAt);
    } else {
      AttestationRequest.V03 v03 = (AttestationRequest.V03) request;
      payload = new AttestationPayloadV03(
          attestationId, profile.id(), request.frameHash(),
          List.of(new ResolvedDomain(v03.domain(), v03.did(), v03.env(), v03.domainDisclosureHash())),
          issuedAt, expiresAt);
    }

    SigningKey key = keys.signingKey();
    String payloadJson = blobs.payloads().write(payload);
    String signature = Ed25519Signatures.sign(key.privateKey(), payloadJson);
    Attestation attestation = new Attestation(AttestationHeader.forKey(key.kid()), payload, signature, payloadJson);
    String blob = blobs.encode(attestation);
    if (log.isDebugEnabled()) {
      log.debug("Encoded blob {}", Logs.truncate(blob, 32));
    }
    return new SignedAttestation(blob, attestation, AttestationBlobCodec.attestationId(blob));
  }

  private static void validateV02Format(AttestationRequest.V02 request, List<String> violations) {
    if (request.decisionOwners().isEmpty()) {
      violations.add("decision_owners must not be empty");
    }
    for (DecisionOwnerScope scope : request.decisionOwnerScopes()) {
      if (!isEnv(scope.env())) {
        violations.add("decision_owner_scopes env must be prod or staging: " + scope.env());
      }
    }
  }

  private static void validateV03(
      AttestationRequest.V03 request, Profile profile, ExecutionPath path, List<String> violations) {
    if (request.did() == null || request.did().isBlank()) {
      violations.add("did must not be blank");
    }
    if (!isEnv(request.env())) {
      violations.add("env must be prod or staging: " + request.env());
    }
    if (!ContentHasher.isContentHash(request.domainDisclosureHash())) {
      violations.add("domain_disclosure_hash must be sha256:<64 hex>");
    }
    if (profile.disclosureSchema().domain(request.domain()).isEmpty()) {
      violations.add("unknown domain: " + request.domain());
    } else if (path.requiredDomains().stream().noneMatch(required -> profile.domainSatisfies(request.domain(), required))) {
      violations.add("domain " + request.domain() + " is not required by " + path.id());
    }
  }

  private static boolean isEnv(String env) {
    return "prod".equals(env) || "staging".equals(env);
  }
}
