package ca.gc.cra.hap.domain.disclosure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * v0.2 disclosure bound into the frame through {@code disclosure_hash}.
 *
 * <p>Collections are treated as sets; the canonical form sorts them, so the order supplied here
 * never affects the hash.</p>
 *
 * @param repo repository slug
 * @param sha commit sha
 * @param changedPaths files changed by the commit
 * @param riskFlags detected risk indicators
 * @param domains domain name to rationale
 * @since 0.3.0
 */
public record Disclosure(
    String repo,
    String sha,
    Set<String> changedPaths,
    Set<String> riskFlags,
    Map<String, DomainRationale> domains) {

  public Disclosure {
    Objects.requireNonNull(repo, "repo");
    Objects.requireNonNull(sha, "sha");
    changedPaths = changedPaths == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(changedPaths));
    riskFlags = riskFlags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(riskFlags));
    domains = domains == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(domains));
  }
}
