package ca.gc.cra.hap.domain.attestation;

import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import java.util.Objects;

/**
 * Fenced plaintext block carried in a pull-request comment.
 *
 * <p>For v0.2 blocks {@code domain} holds the {@code role} key and {@code disclosureHash} the
 * frame-level disclosure hash; for v0.3 they hold {@code domain} and {@code domain_disclosure_hash}.</p>
 *
 * @since 0.3.0
 */
public record AttestationBlock(
    ProtocolVersion version,
    String profile,
    String domain,
    String env,
    String path,
    String sha,
    String frameHash,
    String disclosureHash,
    String blob) {

  public AttestationBlock {
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(env, "env");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(sha, "sha");
    Objects.requireNonNull(frameHash, "frameHash");
    Objects.requireNonNull(disclosureHash, "disclosureHash");
    Objects.requireNonNull(blob, "blob");
  }
}
