package ca.gc.cra.hap.application.executor;

import java.util.List;
import java.util.Objects;

/**
 * What an executor receives: the attestation blob plus the frame parameters of the action it is
 * asked to perform. Never carries disclosure text.
 *
 * @param blob primary attestation blob
 * @param repo repository slug
 * @param sha commit sha
 * @param env target environment
 * @param profileId profile the frame is built under
 * @param executionPath execution path to run
 * @param disclosureHash disclosure hash bound by v0.2 frames, {@code null} for v0.3
 * @param additionalBlobs attestations from other domains for the same frame
 * @since 0.3.0
 */
public record ExecutionRequest(
    String blob,
    String repo,
    String sha,
    String env,
    String profileId,
    String executionPath,
    String disclosureHash,
    List<String> additionalBlobs) {

  public ExecutionRequest {
    Objects.requireNonNull(blob, "blob");
    additionalBlobs = additionalBlobs == null ? List.of() : List.copyOf(additionalBlobs);
  }
}
