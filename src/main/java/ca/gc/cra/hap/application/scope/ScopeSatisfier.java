package ca.gc.cra.hap.application.scope;

import ca.gc.cra.hap.domain.attestation.AttestedScope;
import ca.gc.cra.hap.domain.error.ScopeInsufficientException;
import ca.gc.cra.hap.domain.profile.ExecutionPath;
import ca.gc.cra.hap.domain.profile.Profile;
import ca.gc.cra.hap.domain.profile.ScopeRequirement;
import ca.gc.cra.hap.domain.profile.ScopeSubstitution;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * <strong>What:</strong> Decides whether attested scopes cover an execution path.
 * <p><strong>Rules:</strong></p>
 * <ul>
 *   <li>A requirement is covered by a scope for the same domain, or by a substitute the profile
 *   declares for that domain, in the same environment.</li>
 *   <li>An empty scope set never satisfies a path, even one with no requirements.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.3.0
 */
public final class ScopeSatisfier {

  private ScopeSatisfier() {
    // Utility
  }

  /**
   * Checks attested scopes against a path's requirements.
   *
   * @param profile governing profile
   * @param pathId execution path id
   * @param scopes attested scopes
   * @return coverage detail
   * @throws ca.gc.cra.hap.domain.error.ProtocolException when the path is unknown
   */
  public static CoverageResult check(Profile profile, String pathId, Collection<AttestedScope> scopes) {
    ExecutionPath path = profile.executionPath(pathId);
    List<ScopeRequirement> covered = new ArrayList<>();
    List<ScopeRequirement> missing = new ArrayList<>();
    List<ScopeSubstitution> substitutions = new ArrayList<>();
    for (ScopeRequirement requirement : path.requiredScopes()) {
      AttestedScope match = null;
      for (AttestedScope scope : scopes) {
        if (envMatches(requirement, scope.env()) && profile.domainSatisfies(scope.domain(), requirement.domain())) {
          if (scope.domain().equals(requirement.domain())) {
            match = scope;
            break;
          }
          if (match == null) {
            match = scope;
          }
        }
      }
      if (match == null) {
        missing.add(requirement);
        continue;
      }
      covered.add(requirement);
      if (!match.domain().equals(requirement.domain())) {
        substitutions.add(new ScopeSubstitution(match.domain(), requirement.domain()));
      }
    }
    boolean satisfied = !scopes.isEmpty() && missing.isEmpty();
    return new CoverageResult(path.id(), satisfied, covered, missing, substitutions);
  }

  /**
   * Checks coverage and fails when incomplete.
   *
   * @param profile governing profile
   * @param pathId execution path id
   * @param scopes attested scopes
   * @return satisfied coverage detail
   * @throws ScopeInsufficientException naming every missing requirement
   */
  public static CoverageResult requireSatisfied(Profile profile, String pathId, Collection<AttestedScope> scopes) {
    CoverageResult result = check(profile, pathId, scopes);
    if (!result.satisfied()) {
      throw new ScopeInsufficientException(result.executionPath(), result.missing());
    }
    return result;
  }

  private static boolean envMatches(ScopeRequirement requirement, String env) {
    return requirement.env() == null || requirement.env().equals(env);
  }
}
