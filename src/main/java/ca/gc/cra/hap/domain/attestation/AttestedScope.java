package ca.gc.cra.hap.domain.attestation;

import java.util.Objects;

/**
 * Authority an attestation confers: a decision owner acting for a domain in an environment.
 *
 * @param domain domain the owner speaks for
 * @param env environment the authority applies to
 * @param did decision owner identifier; may be {@code null} when the payload does not bind one
 * @since 0.3.0
 */
public record AttestedScope(String domain, String env, String did) {

  public AttestedScope {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(env, "env");
  }
}
