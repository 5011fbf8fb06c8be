package ca.gc.cra.hap.domain.frame;

import ca.gc.cra.hap.domain.profile.FrameKeys;
import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unvalidated frame fields describing one deployment action. Validation and canonical ordering are
 * applied by the canonicalizer against a profile, so insertion order here carries no meaning.
 *
 * @param fields field name to value
 * @since 0.3.0
 */
public record Frame(Map<String, String> fields) {

  public Frame {
    Map<String, String> copy = new LinkedHashMap<>();
    Objects.requireNonNull(fields, "fields").forEach((key, value) -> {
      if (key != null && value != null) {
        copy.put(key, value);
      }
    });
    fields = Collections.unmodifiableMap(copy);
  }

  /**
   * Builds a v0.2 frame, which binds the disclosure hash.
   *
   * @return frame with six fields
   */
  public static Frame v02(
      String repo, String sha, String env, String profile, String path, String disclosureHash) {
    Map<String, String> fields = base(repo, sha, env, profile, path);
    put(fields, FrameKeys.DISCLOSURE_HASH, disclosureHash);
    return new Frame(fields);
  }

  /**
   * Builds a v0.3 frame.
   *
   * @return frame with five fields
   */
  public static Frame v03(String repo, String sha, String env, String profile, String path) {
    return new Frame(base(repo, sha, env, profile, path));
  }

  /**
   * Builds the frame shape a protocol generation expects.
   *
   * @param disclosureHash bound only by v0.2 frames; ignored for v0.3
   * @return frame for {@code version}
   */
  public static Frame forVersion(
      ProtocolVersion version, String repo, String sha, String env, String profile, String path,
      String disclosureHash) {
    return version == ProtocolVersion.V0_2
        ? v02(repo, sha, env, profile, path, disclosureHash)
        : v03(repo, sha, env, profile, path);
  }

  public String get(String key) {
    return fields.get(key);
  }

  private static Map<String, String> base(
      String repo, String sha, String env, String profile, String path) {
    Map<String, String> fields = new LinkedHashMap<>();
    put(fields, FrameKeys.REPO, repo);
    put(fields, FrameKeys.SHA, sha);
    put(fields, FrameKeys.ENV, env);
    put(fields, FrameKeys.PROFILE, profile);
    put(fields, FrameKeys.PATH, path);
    return fields;
  }

  private static void put(Map<String, String> fields, String key, String value) {
    if (value != null) {
      fields.put(key, value);
    }
  }
}
