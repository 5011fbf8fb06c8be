package ca.gc.cra.hap.domain.disclosure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Author-supplied {@code .hap/decision.json}: the proposed profile, execution path, and per-domain
 * disclosures. Untrusted input; reviewers validate it and attest to the per-domain hashes.
 *
 * @param profile profile id the author proposes
 * @param executionPath execution path the author proposes
 * @param disclosure domain name to its disclosure
 * @since 0.3.0
 */
public record DecisionFile(
    String profile, String executionPath, Map<String, DomainDisclosure> disclosure) {

  public DecisionFile {
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(executionPath, "executionPath");
    disclosure = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(disclosure, "disclosure")));
  }

  public Optional<DomainDisclosure> domain(String name) {
    return Optional.ofNullable(disclosure.get(name));
  }
}
