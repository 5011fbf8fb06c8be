package ca.gc.cra.hap.application.canonical;

import ca.gc.cra.hap.domain.error.ValidationException;
import ca.gc.cra.hap.domain.frame.Frame;
import ca.gc.cra.hap.domain.profile.FrameFieldDefinition;
import ca.gc.cra.hap.domain.profile.FrameKeys;
import ca.gc.cra.hap.domain.profile.FrameSchema;
import ca.gc.cra.hap.domain.profile.Profile;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * <strong>What:</strong> Validates a frame against its profile and renders the canonical form.
 * <p><strong>Why:</strong> Every party must hash byte-identical text for the same action; the profile's
 * key order, not the caller's insertion order, fixes the layout.</p>
 * <p><strong>Format:</strong> one {@code key=value} line per profile key, joined by {@code \n}, no
 * trailing newline.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.3.0
 */
public final class FrameCanonicalizer {

  private FrameCanonicalizer() {
    // Utility
  }

  /**
   * Checks a frame and collects every violation.
   *
   * @param frame candidate frame
   * @param profile profile supplying the schema
   * @return violations; empty when the frame is valid
   */
  public static List<String> validate(Frame frame, Profile profile) {
    FrameSchema schema = profile.frameSchema();
    List<String> violations = new ArrayList<>();
    for (String key : frame.fields().keySet()) {
      if (!schema.fields().containsKey(key)) {
        violations.add("unknown field: " + key);
      }
    }
    for (Map.Entry<String, FrameFieldDefinition> entry : schema.fields().entrySet()) {
      String key = entry.getKey();
      FrameFieldDefinition definition = entry.getValue();
      String value = frame.get(key);
      if (value == null) {
        if (definition.required()) {
          violations.add("missing required field: " + key);
        }
        continue;
      }
      if (!definition.matches(value)) {
        violations.add("invalid " + key + ": '" + value + "' does not match " + definition.pattern().pattern());
      } else if (!definition.allowedValues().isEmpty() && !definition.allowedValues().contains(value)) {
        violations.add("invalid " + key + ": '" + value + "' not in " + definition.allowedValues());
      }
    }
    String declared = frame.get(FrameKeys.PROFILE);
    if (declared != null && !declared.equals(profile.id())) {
      violations.add("profile field '" + declared + "' does not match profile " + profile.id());
    }
    return violations;
  }

  /**
   * Renders the canonical frame string.
   *
   * @param frame frame to render
   * @param profile profile supplying key order and validation
   * @return canonical text
   * @throws ValidationException listing every violation when the frame is invalid
   */
  public static String canonicalize(Frame frame, Profile profile) {
    List<String> violations = validate(frame, profile);
    if (!violations.isEmpty()) {
      throw new ValidationException("frame", violations);
    }
    StringJoiner lines = new StringJoiner("\n");
    for (String key : profile.frameSchema().keyOrder()) {
      String value = frame.get(key);
      if (value != null) {
        lines.add(key + "=" + value);
      }
    }
    return lines.toString();
  }

  /**
   * Computes the frame hash.
   *
   * @param frame frame to hash
   * @param profile profile supplying key order and validation
   * @return {@code sha256:} prefixed digest of the canonical text
   * @throws ValidationException when the frame is invalid
   */
  public static String frameHash(Frame frame, Profile profile) {
    return ContentHasher.hash(canonicalize(frame, profile));
  }
}
