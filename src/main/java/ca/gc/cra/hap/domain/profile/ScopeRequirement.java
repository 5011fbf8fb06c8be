package ca.gc.cra.hap.domain.profile;

import java.util.Objects;

/**
 * A {@code (domain, env)} pair an execution path requires to be attested.
 *
 * @param domain organizational domain, e.g. {@code engineering}
 * @param env environment the authority applies to, or {@code null} for any environment
 * @since 0.3.0
 */
public record ScopeRequirement(String domain, String env) {

  public ScopeRequirement {
    Objects.requireNonNull(domain, "domain");
  }

  @Override
  public String toString() {
    return env == null ? domain : domain + "@" + env;
  }
}
