package ca.gc.cra.hap.domain.profile;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validation rule for a single frame field.
 *
 * @param description human readable purpose
 * @param pattern full-match pattern the value must satisfy
 * @param required whether the field must be present
 * @param allowedValues closed value set; empty when any pattern match is accepted
 * @since 0.3.0
 */
public record FrameFieldDefinition(
    String description, Pattern pattern, boolean required, List<String> allowedValues) {

  public FrameFieldDefinition {
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(pattern, "pattern");
    allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
  }

  static FrameFieldDefinition required(String description, String regex) {
    return new FrameFieldDefinition(description, Pattern.compile(regex), true, List.of());
  }

  static FrameFieldDefinition required(String description, String regex, List<String> allowed) {
    return new FrameFieldDefinition(description, Pattern.compile(regex), true, allowed);
  }

  /**
   * Tests a candidate value against the pattern.
   *
   * @param value candidate value
   * @return {@code true} when the whole value matches
   */
  public boolean matches(String value) {
    return value != null && pattern.matcher(value).matches();
  }
}
