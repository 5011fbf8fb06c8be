package ca.gc.cra.hap.domain.profile;

import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Versioned bundle of every rule a deploy gate enforces.
 * <p><strong>Why:</strong> Canonicalization, signing, verification, and authorization must all agree
 * on the same key order, field patterns, and scope requirements; a profile id pins that agreement.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @param id profile identifier, e.g. {@code deploy-gate@0.3}
 * @param version protocol generation
 * @param requiredGates gates that must be resolved before signing
 * @param frameSchema canonical frame layout
 * @param disclosureSchema disclosure fields per domain
 * @param executionPaths path id to path definition, in declaration order
 * @param substitutions one-way scope substitutions
 * @param ttl attestation lifetime bounds
 * @param sdgSet ordered SDG identifiers evaluated for this profile
 * @since 0.3.0
 */
public record Profile(
    String id,
    ProtocolVersion version,
    List<String> requiredGates,
    FrameSchema frameSchema,
    DisclosureSchema disclosureSchema,
    Map<String, ExecutionPath> executionPaths,
    List<ScopeSubstitution> substitutions,
    TtlPolicy ttl,
    List<String> sdgSet) {

  public Profile {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(version, "version");
    requiredGates = List.copyOf(requiredGates);
    Objects.requireNonNull(frameSchema, "frameSchema");
    Objects.requireNonNull(disclosureSchema, "disclosureSchema");
    executionPaths = Collections.unmodifiableMap(new LinkedHashMap<>(executionPaths));
    substitutions = List.copyOf(substitutions);
    Objects.requireNonNull(ttl, "ttl");
    sdgSet = List.copyOf(sdgSet);
  }

  /**
   * Resolves an execution path by id.
   *
   * @param pathId path identifier
   * @return the path definition
   * @throws ProtocolException {@link ErrorCode#UNKNOWN_EXECUTION_PATH} when the profile does not define it
   */
  public ExecutionPath executionPath(String pathId) {
    ExecutionPath path = pathId == null ? null : executionPaths.get(pathId);
    if (path == null) {
      throw new ProtocolException(
          ErrorCode.UNKNOWN_EXECUTION_PATH, "profile " + id + " has no execution path " + pathId);
    }
    return path;
  }

  /**
   * Reports whether an attestation for {@code attested} may satisfy a requirement for {@code required}.
   *
   * @param attested domain carried by an attestation
   * @param required domain named by a requirement
   * @return {@code true} for an exact match or a declared substitution
   */
  public boolean domainSatisfies(String attested, String required) {
    if (attested.equals(required)) {
      return true;
    }
    for (ScopeSubstitution substitution : substitutions) {
      if (substitution.substitute().equals(attested) && substitution.standsInFor().equals(required)) {
        return true;
      }
    }
    return false;
  }
}
