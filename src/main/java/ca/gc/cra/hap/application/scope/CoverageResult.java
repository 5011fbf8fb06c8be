package ca.gc.cra.hap.application.scope;

import ca.gc.cra.hap.domain.profile.ScopeRequirement;
import ca.gc.cra.hap.domain.profile.ScopeSubstitution;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of matching attested scopes against an execution path.
 *
 * @param executionPath path checked
 * @param satisfied whether every requirement is covered
 * @param covered requirements that are covered
 * @param missing requirements still needing an attestation
 * @param substitutions substitutions that were needed to cover a requirement
 * @since 0.3.0
 */
public record CoverageResult(
    String executionPath,
    boolean satisfied,
    List<ScopeRequirement> covered,
    List<ScopeRequirement> missing,
    List<ScopeSubstitution> substitutions) {

  public CoverageResult {
    covered = List.copyOf(covered);
    missing = List.copyOf(missing);
    substitutions = List.copyOf(substitutions);
  }

  /**
   * Returns the domains still needing an attestation.
   *
   * @return missing domains in requirement order
   */
  public Set<String> missingDomains() {
    Set<String> domains = new LinkedHashSet<>();
    missing.forEach(requirement -> domains.add(requirement.domain()));
    return domains;
  }
}
