package ca.gc.cra.hap.application.sdg;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated, ordered set of guards ready for evaluation.
 *
 * <p>Compilation rejects unknown rule expressions, duplicate ids, guards without rules, and any
 * {@code stop_trigger} guard that references a semantic predicate.</p>
 *
 * @since 0.3.0
 */
public final class SdgRuleSet {
  private final Map<String, CompiledSdg> guards;

  private SdgRuleSet(Map<String, CompiledSdg> guards) {
    this.guards = Collections.unmodifiableMap(guards);
  }

  /**
   * Compiles definitions in the given order.
   *
   * @param definitions guard definitions
   * @return compiled rule set
   * @throws IllegalArgumentException when a definition is invalid
   */
  public static SdgRuleSet compile(Collection<SdgDefinition> definitions) {
    Objects.requireNonNull(definitions, "definitions");
    Map<String, CompiledSdg> compiled = new LinkedHashMap<>();
    for (SdgDefinition definition : definitions) {
      if (compiled.containsKey(definition.id())) {
        throw new IllegalArgumentException("Duplicate SDG id detected: " + definition.id());
      }
      compiled.put(definition.id(), compileOne(definition));
    }
    return new SdgRuleSet(compiled);
  }

  private static CompiledSdg compileOne(SdgDefinition definition) {
    if (definition.id().isBlank()) {
      throw new IllegalArgumentException("SDG id must not be blank");
    }
    if (definition.detectionRules().isEmpty()) {
      throw new IllegalArgumentException("SDG " + definition.id() + " declares no detection_rules");
    }
    List<DetectionPredicate> predicates = new ArrayList<>();
    for (String rule : definition.detectionRules()) {
      DetectionPredicate predicate = DetectionPredicate.fromExpression(rule)
          .orElseThrow(() -> new IllegalArgumentException(
              "SDG " + definition.id() + " uses unknown detection rule: " + rule));
      if (definition.stopTrigger() && !predicate.structural()) {
        throw new IllegalArgumentException(
            "SDG " + definition.id() + " is a hard stop but uses semantic rule: " + rule);
      }
      predicates.add(predicate);
    }
    return new CompiledSdg(definition, predicates);
  }

  /**
   * Returns the subset named by {@code ids}, in the order given.
   *
   * @param ids guard identifiers
   * @return narrowed rule set
   * @throws IllegalArgumentException when an id is not present
   */
  public SdgRuleSet select(Collection<String> ids) {
    Map<String, CompiledSdg> selected = new LinkedHashMap<>();
    for (String id : ids) {
      CompiledSdg guard = guards.get(id);
      if (guard == null) {
        throw new IllegalArgumentException("Unknown SDG id: " + id);
      }
      selected.put(id, guard);
    }
    return new SdgRuleSet(selected);
  }

  public Optional<SdgDefinition> get(String id) {
    return Optional.ofNullable(guards.get(id)).map(CompiledSdg::definition);
  }

  public List<SdgDefinition> definitions() {
    List<SdgDefinition> out = new ArrayList<>(guards.size());
    guards.values().forEach(guard -> out.add(guard.definition()));
    return out;
  }

  public int size() {
    return guards.size();
  }

  Collection<CompiledSdg> guards() {
    return guards.values();
  }
}
