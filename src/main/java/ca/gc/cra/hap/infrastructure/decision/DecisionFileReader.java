package ca.gc.cra.hap.infrastructure.decision;

import ca.gc.cra.hap.application.json.JsonSupport;
import ca.gc.cra.hap.domain.disclosure.DecisionFile;
import ca.gc.cra.hap.domain.disclosure.Disclosure;
import ca.gc.cra.hap.domain.disclosure.DomainDisclosure;
import ca.gc.cra.hap.domain.disclosure.DomainRationale;
import ca.gc.cra.hap.domain.error.ValidationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an author-supplied {@code .hap/decision.json}, and v0.2 disclosure documents.
 *
 * <pre>
 * {
 *   "profile": "deploy-gate@0.3",
 *   "execution_path": "deploy-prod-canary",
 *   "disclosure": {
 *     "engineering": { "summary": "...", "changed_paths": ["src/app.ts"], ... }
 *   }
 * }
 * </pre>
 *
 * <p>The file is untrusted. Structural problems are collected and reported together as a
 * {@link ValidationException}; schema checks against a profile happen later.</p>
 *
 * @since 0.3.0
 */
public final class DecisionFileReader {
  private static final Logger log = LoggerFactory.getLogger(DecisionFileReader.class);
  private static final String CONTEXT = "decision_file";
  private static final String DISCLOSURE_CONTEXT = "disclosure";
  public static final String DEFAULT_LOCATION = ".hap/decision.json";

  private final JsonSupport json;

  public DecisionFileReader(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Reads a decision file.
   *
   * @param path file location
   * @return parsed decision file
   * @throws IOException when the file cannot be read
   * @throws ValidationException when the content is structurally invalid
   */
  public DecisionFile read(Path path) throws IOException {
    return parse(Files.readString(path, StandardCharsets.UTF_8));
  }

  /**
   * Reads a decision file when it exists.
   *
   * @param path file location
   * @return parsed file, or empty when absent
   * @throws IOException when the file exists but cannot be read
   */
  public Optional<DecisionFile> readIfPresent(Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      log.debug("No decision file at {}", path);
      return Optional.empty();
    }
    return Optional.of(read(path));
  }

  /**
   * Parses decision-file JSON text.
   *
   * @param text JSON document
   * @return parsed decision file
   * @throws ValidationException when the content is structurally invalid
   */
  public DecisionFile parse(String text) {
    Map<String, Object> root;
    try {
      root = json.parseObject(text);
    } catch (IllegalArgumentException ex) {
      throw new ValidationException(CONTEXT, List.of("not a JSON object: " + ex.getMessage()));
    }
    List<String> violations = new ArrayList<>();
    String profile = requireText(root, "profile", violations);
    String executionPath = requireText(root, "execution_path", violations);
    Map<String, DomainDisclosure> domains = new LinkedHashMap<>();
    Object disclosure = root.get("disclosure");
    if (!(disclosure instanceof Map<?, ?> disclosureMap)) {
      violations.add("disclosure must be an object");
    } else {
      for (Map.Entry<?, ?> entry : disclosureMap.entrySet()) {
        String domain = String.valueOf(entry.getKey());
        readDomain(domain, entry.getValue(), violations).ifPresent(d -> domains.put(domain, d));
      }
    }
    if (!violations.isEmpty()) {
      throw new ValidationException(CONTEXT, violations);
    }
    return new DecisionFile(profile, executionPath, domains);
  }

  /**
   * Parses a v0.2 disclosure document: repo, sha, changed paths, risk flags, and optional
   * per-domain problem/objective/tradeoffs.
   *
   * @param text JSON document
   * @return parsed disclosure
   * @throws ValidationException when the content is structurally invalid
   */
  public Disclosure parseDisclosure(String text) {
    Map<String, Object> root;
    try {
      root = json.parseObject(text);
    } catch (IllegalArgumentException ex) {
      throw new ValidationException(DISCLOSURE_CONTEXT, List.of("not a JSON object: " + ex.getMessage()));
    }
    List<String> violations = new ArrayList<>();
    String repo = requireText(root, "repo", violations);
    String sha = requireText(root, "sha", violations);
    List<String> changedPaths = textList(root.get("changed_paths"), "changed_paths", violations);
    List<String> riskFlags = textList(root.get("risk_flags"), "risk_flags", violations);
    Map<String, DomainRationale> domains = new LinkedHashMap<>();
    Object domainsNode = root.get("domains");
    if (domainsNode instanceof Map<?, ?> domainMap) {
      for (Map.Entry<?, ?> entry : domainMap.entrySet()) {
        String domain = String.valueOf(entry.getKey());
        if (!(entry.getValue() instanceof Map<?, ?> rationale)) {
          violations.add("domains." + domain + " must be an object");
          continue;
        }
        domains.put(domain, new DomainRationale(
            text(rationale.get("problem")), text(rationale.get("objective")), text(rationale.get("tradeoffs"))));
      }
    } else if (domainsNode != null) {
      violations.add("domains must be an object");
    }
    if (!violations.isEmpty()) {
      throw new ValidationException(DISCLOSURE_CONTEXT, violations);
    }
    return new Disclosure(repo, sha, new LinkedHashSet<>(changedPaths), new LinkedHashSet<>(riskFlags), domains);
  }

  private static List<String> textList(Object node, String key, List<String> violations) {
    if (node == null) {
      return List.of();
    }
    if (node instanceof List<?> list && list.stream().allMatch(String.class::isInstance)) {
      List<String> items = new ArrayList<>(list.size());
      list.forEach(item -> items.add((String) item));
      return items;
    }
    violations.add(key + " must be a list of strings");
    return List.of();
  }

  private static String text(Object value) {
    return value instanceof String str ? str : "";
  }

  private Optional<DomainDisclosure> readDomain(String domain, Object node, List<String> violations) {
    if (!(node instanceof Map<?, ?> fieldMap)) {
      violations.add("disclosure." + domain + " must be an object");
      return Optional.empty();
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    boolean valid = true;
    for (Map.Entry<?, ?> field : fieldMap.entrySet()) {
      String name = String.valueOf(field.getKey());
      Object value = field.getValue();
      if (value instanceof String text) {
        fields.put(name, text);
      } else if (value instanceof List<?> list && list.stream().allMatch(String.class::isInstance)) {
        List<String> items = new ArrayList<>(list.size());
        list.forEach(item -> items.add((String) item));
        fields.put(name, items);
      } else {
        violations.add("disclosure." + domain + "." + name + " must be a string or list of strings");
        valid = false;
      }
    }
    return valid ? Optional.of(new DomainDisclosure(domain, fields)) : Optional.empty();
  }

  private static String requireText(Map<String, Object> root, String key, List<String> violations) {
    Object value = root.get(key);
    if (value instanceof String text && !text.isBlank()) {
      return text;
    }
    violations.add(key + " must be a non-empty string");
    return null;
  }
}
