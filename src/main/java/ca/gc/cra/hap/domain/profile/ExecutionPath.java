package ca.gc.cra.hap.domain.profile;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named deployment action and the scopes that must approve it.
 *
 * @param id path identifier, e.g. {@code deploy-prod-canary}
 * @param description human readable summary
 * @param requiredScopes scopes that must all be covered
 * @since 0.3.0
 */
public record ExecutionPath(String id, String description, List<ScopeRequirement> requiredScopes) {

  public ExecutionPath {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(description, "description");
    requiredScopes = List.copyOf(Objects.requireNonNull(requiredScopes, "requiredScopes"));
  }

  /**
   * Returns the distinct domains named by the required scopes, in declaration order.
   *
   * @return required domain names
   */
  public Set<String> requiredDomains() {
    Set<String> domains = new LinkedHashSet<>();
    for (ScopeRequirement scope : requiredScopes) {
      domains.add(scope.domain());
    }
    return domains;
  }
}
