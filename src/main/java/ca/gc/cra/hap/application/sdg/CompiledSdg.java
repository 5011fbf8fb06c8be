package ca.gc.cra.hap.application.sdg;

import java.util.List;
import java.util.Objects;

/** Guard definition paired with its resolved predicates. */
final class CompiledSdg {
  private final SdgDefinition definition;
  private final List<DetectionPredicate> predicates;

  CompiledSdg(SdgDefinition definition, List<DetectionPredicate> predicates) {
    this.definition = Objects.requireNonNull(definition, "definition");
    this.predicates = List.copyOf(predicates);
  }

  SdgDefinition definition() {
    return definition;
  }

  List<DetectionPredicate> predicates() {
    return predicates;
  }

  SdgResult evaluate(SdgContext context) {
    boolean triggered = false;
    for (DetectionPredicate predicate : predicates) {
      if (predicate.test(context)) {
        triggered = true;
        break;
      }
    }
    return new SdgResult(
        definition.id(),
        definition.signalIntent(),
        triggered,
        definition.stopTrigger(),
        triggered ? definition.userPrompt() : null);
  }
}
