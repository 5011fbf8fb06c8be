package ca.gc.cra.hap.domain.attestation;

import java.util.Objects;

/**
 * v0.3 payload entry: the domain attested, who attested it, and the disclosure they reviewed.
 *
 * @param domain domain
 * @param did decision owner identifier
 * @param env environment
 * @param disclosureHash hash of the domain disclosure reviewed
 * @since 0.3.0
 */
public record ResolvedDomain(String domain, String did, String env, String disclosureHash) {

  public ResolvedDomain {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(did, "did");
    Objects.requireNonNull(env, "env");
    Objects.requireNonNull(disclosureHash, "disclosureHash");
  }

  AttestedScope toScope() {
    return new AttestedScope(domain, env, did);
  }
}
