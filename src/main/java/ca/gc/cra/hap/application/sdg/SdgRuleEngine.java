package ca.gc.cra.hap.application.sdg;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates a compiled guard set against a review context. Evaluation is a pure function of the
 * two inputs: no I/O, no clock, and no mutation of the context.
 *
 * @since 0.3.0
 */
public final class SdgRuleEngine {
  private final SdgRuleSet ruleSet;

  public SdgRuleEngine(SdgRuleSet ruleSet) {
    this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet");
  }

  public SdgRuleSet ruleSet() {
    return ruleSet;
  }

  /**
   * Evaluates every guard in catalogue order.
   *
   * @param context review context
   * @return results partitioned into hard stops and warnings
   */
  public SdgEvaluation evaluate(SdgContext context) {
    Objects.requireNonNull(context, "context");
    List<SdgResult> results = new ArrayList<>(ruleSet.size());
    List<SdgResult> hardStops = new ArrayList<>();
    List<SdgResult> warnings = new ArrayList<>();
    for (CompiledSdg guard : ruleSet.guards()) {
      SdgResult result = guard.evaluate(context);
      results.add(result);
      if (result.hardStop()) {
        hardStops.add(result);
      } else if (result.warning()) {
        warnings.add(result);
      }
    }
    return new SdgEvaluation(results, hardStops, warnings);
  }
}
