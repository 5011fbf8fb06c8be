package ca.gc.cra.hap.application.canonical;

import ca.gc.cra.hap.domain.disclosure.DecisionFile;
import ca.gc.cra.hap.domain.disclosure.Disclosure;
import ca.gc.cra.hap.domain.disclosure.DomainDisclosure;
import ca.gc.cra.hap.domain.disclosure.DomainRationale;
import ca.gc.cra.hap.domain.error.ValidationException;
import ca.gc.cra.hap.domain.profile.DisclosureFieldDefinition;
import ca.gc.cra.hap.domain.profile.DisclosureFieldType;
import ca.gc.cra.hap.domain.profile.ExecutionPath;
import ca.gc.cra.hap.domain.profile.Profile;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks disclosure content against a profile's disclosure schema.
 *
 * <p>Reports every problem at once: unknown domains, missing fields, unexpected fields, wrong value
 * types, and text outside its length bounds.</p>
 *
 * @since 0.3.0
 */
public final class DisclosureValidator {

  private DisclosureValidator() {
    // Utility
  }

  /**
   * Validates one v0.3 domain disclosure.
   *
   * @param disclosure domain content
   * @param profile governing profile
   * @return violations prefixed by the domain name; empty when valid
   */
  public static List<String> validate(DomainDisclosure disclosure, Profile profile) {
    List<String> violations = new ArrayList<>();
    String domain = disclosure.domain();
    Optional<Map<String, DisclosureFieldDefinition>> schema = profile.disclosureSchema().domain(domain);
    if (schema.isEmpty()) {
      violations.add("unknown domain: " + domain);
      return violations;
    }
    Map<String, DisclosureFieldDefinition> fields = schema.get();
    for (Map.Entry<String, DisclosureFieldDefinition> entry : fields.entrySet()) {
      checkField(domain, entry.getKey(), entry.getValue(), disclosure.fields().get(entry.getKey()), violations);
    }
    for (String name : disclosure.fields().keySet()) {
      if (!fields.containsKey(name)) {
        violations.add(domain + ": unknown field " + name);
      }
    }
    return violations;
  }

  /**
   * Lists the schema fields a domain disclosure is missing or leaves out of bounds.
   *
   * @param disclosure domain content, or {@code null} when the domain is absent entirely
   * @param domain domain name
   * @param profile governing profile
   * @return {@code domain.field} identifiers for every missing or invalid field
   */
  public static List<String> missingFields(DomainDisclosure disclosure, String domain, Profile profile) {
    List<String> missing = new ArrayList<>();
    Map<String, DisclosureFieldDefinition> fields = profile.disclosureSchema().domain(domain).orElse(Map.of());
    for (Map.Entry<String, DisclosureFieldDefinition> entry : fields.entrySet()) {
      Object value = disclosure == null ? null : disclosure.fields().get(entry.getKey());
      List<String> problems = new ArrayList<>();
      checkField(domain, entry.getKey(), entry.getValue(), value, problems);
      if (!problems.isEmpty()) {
        missing.add(domain + "." + entry.getKey());
      }
    }
    return missing;
  }

  /**
   * Validates a decision file against a profile: the profile id must match, the execution path must
   * exist, every required domain must be present, and every domain must satisfy its schema.
   *
   * @param decisionFile untrusted decision file
   * @param profile governing profile
   * @throws ValidationException listing all violations
   */
  public static void requireValid(DecisionFile decisionFile, Profile profile) {
    List<String> violations = new ArrayList<>();
    if (!profile.id().equals(decisionFile.profile())) {
      violations.add("decision file profile '" + decisionFile.profile() + "' does not match " + profile.id());
    }
    ExecutionPath path = profile.executionPaths().get(decisionFile.executionPath());
    if (path == null) {
      violations.add("unknown execution path: " + decisionFile.executionPath());
    } else {
      for (String domain : path.requiredDomains()) {
        if (decisionFile.domain(domain).isEmpty()) {
          violations.add("missing disclosure for required domain: " + domain);
        }
      }
    }
    for (DomainDisclosure disclosure : decisionFile.disclosure().values()) {
      violations.addAll(validate(disclosure, profile));
    }
    if (!violations.isEmpty()) {
      throw new ValidationException("decision file", violations);
    }
  }

  /**
   * Validates the domain rationales of a v0.2 disclosure.
   *
   * @param disclosure v0.2 disclosure
   * @param profile governing profile
   * @return violations; empty when valid
   */
  public static List<String> validate(Disclosure disclosure, Profile profile) {
    List<String> violations = new ArrayList<>();
    for (Map.Entry<String, DomainRationale> entry : disclosure.domains().entrySet()) {
      String domain = entry.getKey();
      Optional<Map<String, DisclosureFieldDefinition>> schema = profile.disclosureSchema().domain(domain);
      if (schema.isEmpty()) {
        violations.add("unknown domain: " + domain);
        continue;
      }
      DomainRationale rationale = entry.getValue();
      Map<String, DisclosureFieldDefinition> fields = schema.get();
      checkField(domain, "problem", fields.get("problem"), rationale.problem(), violations);
      checkField(domain, "objective", fields.get("objective"), rationale.objective(), violations);
      checkField(domain, "tradeoffs", fields.get("tradeoffs"), rationale.tradeoffs(), violations);
    }
    return violations;
  }

  private static void checkField(
      String domain, String name, DisclosureFieldDefinition definition, Object value, List<String> violations) {
    if (definition == null) {
      violations.add(domain + ": unknown field " + name);
      return;
    }
    if (value == null) {
      violations.add(domain + ": missing field " + name);
      return;
    }
    if (definition.type() == DisclosureFieldType.STRING_LIST) {
      if (!(value instanceof List<?>)) {
        violations.add(domain + ": field " + name + " must be " + definition.type().label());
      }
      return;
    }
    if (!(value instanceof String text)) {
      violations.add(domain + ": field " + name + " must be " + definition.type().label());
      return;
    }
    int length = text.length();
    if (definition.minLength() != null && length < definition.minLength()) {
      violations.add(domain + ": field " + name + " shorter than " + definition.minLength());
    }
    if (definition.maxLength() != null && length > definition.maxLength()) {
      violations.add(domain + ": field " + name + " longer than " + definition.maxLength());
    }
  }
}
