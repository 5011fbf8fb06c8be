package ca.gc.cra.hap.application.sdg;

import java.util.List;

/**
 * All guard results for one review context, partitioned into hard stops and warnings.
 *
 * @param results every evaluated guard, in catalogue order
 * @param hardStops triggered guards with {@code stopTrigger}
 * @param warnings triggered guards without {@code stopTrigger}
 * @since 0.3.0
 */
public record SdgEvaluation(List<SdgResult> results, List<SdgResult> hardStops, List<SdgResult> warnings) {

  public SdgEvaluation {
    results = List.copyOf(results);
    hardStops = List.copyOf(hardStops);
    warnings = List.copyOf(warnings);
  }

  public boolean hasHardStop() {
    return !hardStops.isEmpty();
  }
}
