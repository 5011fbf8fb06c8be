package ca.gc.cra.hap.application.canonical;

import ca.gc.cra.hap.application.json.JsonSupport;
import ca.gc.cra.hap.domain.disclosure.DecisionFile;
import ca.gc.cra.hap.domain.disclosure.Disclosure;
import ca.gc.cra.hap.domain.disclosure.DomainDisclosure;
import ca.gc.cra.hap.domain.disclosure.DomainRationale;
import ca.gc.cra.hap.domain.error.ValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical JSON forms for disclosures.
 *
 * <p>Output is compact JSON with object keys sorted at every depth and set-typed values sorted, so
 * two parties holding the same content in any order produce the same bytes.</p>
 *
 * @since 0.3.0
 */
public final class DisclosureCanonicalizer {
  static final String CHANGED_PATHS = "changed_paths";

  private static final JsonSupport JSON = new JsonSupport();

  private DisclosureCanonicalizer() {
    // Utility
  }

  /**
   * Renders a v0.2 disclosure. {@code domains} is included only when at least one domain rationale
   * is present.
   *
   * @param disclosure disclosure to render
   * @return canonical JSON
   * @throws ValidationException when a changed path is invalid
   */
  public static String canonicalize(Disclosure disclosure) {
    Map<String, Object> canonical = new TreeMap<>();
    canonical.put(CHANGED_PATHS, PathNormalizer.normalizeAll(disclosure.changedPaths()));
    canonical.put("repo", disclosure.repo());
    canonical.put("risk_flags", sorted(disclosure.riskFlags()));
    canonical.put("sha", disclosure.sha());
    if (!disclosure.domains().isEmpty()) {
      Map<String, Object> domains = new TreeMap<>();
      for (Map.Entry<String, DomainRationale> entry : disclosure.domains().entrySet()) {
        DomainRationale rationale = entry.getValue();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("objective", rationale.objective());
        fields.put("problem", rationale.problem());
        fields.put("tradeoffs", rationale.tradeoffs());
        domains.put(entry.getKey(), fields);
      }
      canonical.put("domains", domains);
    }
    return JSON.write(canonical, true);
  }

  /**
   * Hashes a v0.2 disclosure.
   *
   * @param disclosure disclosure to hash
   * @return content hash of the canonical form
   */
  public static String disclosureHash(Disclosure disclosure) {
    return ContentHasher.hash(canonicalize(disclosure));
  }

  /**
   * Renders one v0.3 domain disclosure. Only that domain's fields participate.
   *
   * @param disclosure domain disclosure
   * @return canonical JSON of its fields
   * @throws ValidationException when {@code changed_paths} holds an invalid path
   */
  public static String canonicalize(DomainDisclosure disclosure) {
    Map<String, Object> canonical = new TreeMap<>();
    for (Map.Entry<String, Object> entry : disclosure.fields().entrySet()) {
      Object value = entry.getValue();
      if (value instanceof List<?> list) {
        List<String> items = new ArrayList<>();
        for (Object item : list) {
          items.add((String) item);
        }
        value = CHANGED_PATHS.equals(entry.getKey()) ? PathNormalizer.normalizeAll(items) : sorted(items);
      }
      canonical.put(entry.getKey(), value);
    }
    return JSON.write(canonical, true);
  }

  /**
   * Hashes one v0.3 domain disclosure.
   *
   * @param disclosure domain disclosure
   * @return content hash of the canonical form
   */
  public static String domainDisclosureHash(DomainDisclosure disclosure) {
    return ContentHasher.hash(canonicalize(disclosure));
  }

  /**
   * Hashes every domain of a decision file.
   *
   * @param decisionFile decision file
   * @return domain name to hash, ordered by domain name
   */
  public static Map<String, String> domainDisclosureHashes(DecisionFile decisionFile) {
    Map<String, String> hashes = new TreeMap<>();
    decisionFile.disclosure().forEach((domain, disclosure) -> hashes.put(domain, domainDisclosureHash(disclosure)));
    return hashes;
  }

  private static List<String> sorted(Iterable<String> values) {
    List<String> list = new ArrayList<>();
    values.forEach(list::add);
    list.sort(null);
    return list;
  }
}
