package ca.gc.cra.hap.application.sdg;

import java.util.List;
import java.util.Objects;

/**
 * Declarative Semantic Drift Guard definition.
 *
 * @param id versioned identifier, for example {@code deploy/commitment_mismatch@1.0}
 * @param signalIntent short statement of what the guard protects
 * @param description longer human description
 * @param observableStructures inputs the detection rules read
 * @param detectionRules rule expressions; the guard triggers when any rule holds
 * @param stopTrigger whether a trigger blocks the workflow
 * @param userPrompt message shown when the guard triggers
 * @since 0.3.0
 */
public record SdgDefinition(
    String id,
    String signalIntent,
    String description,
    List<String> observableStructures,
    List<String> detectionRules,
    boolean stopTrigger,
    String userPrompt) {

  public SdgDefinition {
    Objects.requireNonNull(id, "id");
    signalIntent = signalIntent == null ? "" : signalIntent;
    description = description == null ? "" : description;
    observableStructures = observableStructures == null ? List.of() : List.copyOf(observableStructures);
    detectionRules = detectionRules == null ? List.of() : List.copyOf(detectionRules);
    userPrompt = userPrompt == null ? "" : userPrompt;
  }
}
