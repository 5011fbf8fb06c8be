package ca.gc.cra.hap.domain.attestation;

import java.util.Objects;

/**
 * v0.2 payload entry binding a decision owner to a scope.
 *
 * @param did decision owner identifier, may be {@code null}
 * @param domain domain
 * @param env environment
 * @since 0.3.0
 */
public record DecisionOwnerScope(String did, String domain, String env) {

  public DecisionOwnerScope {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(env, "env");
  }

  AttestedScope toScope() {
    return new AttestedScope(domain, env, did);
  }
}
