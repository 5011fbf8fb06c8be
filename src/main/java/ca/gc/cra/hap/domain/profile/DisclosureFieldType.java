package ca.gc.cra.hap.domain.profile;

/**
 * Value shape of a disclosure field.
 *
 * @since 0.3.0
 */
public enum DisclosureFieldType {
  STRING("string"),
  STRING_LIST("string[]");

  private final String label;

  DisclosureFieldType(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
