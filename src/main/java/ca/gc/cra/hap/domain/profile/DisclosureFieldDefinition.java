package ca.gc.cra.hap.domain.profile;

import java.util.Objects;

/**
 * Schema entry for one disclosure field.
 *
 * @param type value shape
 * @param description prompt shown to the author
 * @param minLength inclusive lower bound on text length, or {@code null}
 * @param maxLength inclusive upper bound on text length, or {@code null}
 * @since 0.3.0
 */
public record DisclosureFieldDefinition(
    DisclosureFieldType type, String description, Integer minLength, Integer maxLength) {

  public DisclosureFieldDefinition {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(description, "description");
    if (minLength != null && maxLength != null && minLength > maxLength) {
      throw new IllegalArgumentException("minLength > maxLength");
    }
  }

  static DisclosureFieldDefinition text(String description) {
    return new DisclosureFieldDefinition(DisclosureFieldType.STRING, description, null, null);
  }

  static DisclosureFieldDefinition text(String description, int min, int max) {
    return new DisclosureFieldDefinition(DisclosureFieldType.STRING, description, min, max);
  }

  static DisclosureFieldDefinition list(String description) {
    return new DisclosureFieldDefinition(DisclosureFieldType.STRING_LIST, description, null, null);
  }
}
