package ca.gc.cra.hap.domain.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fields each domain must articulate, plus fields shared by every domain.
 *
 * @param shared fields common to the whole disclosure
 * @param domains domain name to its ordered field definitions
 * @since 0.3.0
 */
public record DisclosureSchema(
    Map<String, DisclosureFieldDefinition> shared,
    Map<String, Map<String, DisclosureFieldDefinition>> domains) {

  public DisclosureSchema {
    shared = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(shared, "shared")));
    Map<String, Map<String, DisclosureFieldDefinition>> copy = new LinkedHashMap<>();
    Objects.requireNonNull(domains, "domains")
        .forEach((name, fields) -> copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
    domains = Collections.unmodifiableMap(copy);
  }

  /**
   * Looks up the field definitions for a domain.
   *
   * @param domain domain name
   * @return ordered field definitions, or empty when the domain is unknown
   */
  public Optional<Map<String, DisclosureFieldDefinition>> domain(String domain) {
    return Optional.ofNullable(domains.get(domain));
  }
}
