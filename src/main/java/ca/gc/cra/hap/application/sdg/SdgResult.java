package ca.gc.cra.hap.application.sdg;

/**
 * Outcome of evaluating one guard.
 *
 * @param id guard identifier
 * @param signalIntent guard intent
 * @param triggered whether any detection rule held
 * @param stopTrigger whether the guard is a hard stop
 * @param userPrompt prompt to show, or {@code null} when not triggered
 * @since 0.3.0
 */
public record SdgResult(
    String id, String signalIntent, boolean triggered, boolean stopTrigger, String userPrompt) {

  public boolean hardStop() {
    return triggered && stopTrigger;
  }

  public boolean warning() {
    return triggered && !stopTrigger;
  }
}
