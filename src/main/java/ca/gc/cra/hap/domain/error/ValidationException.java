package ca.gc.cra.hap.domain.error;

import java.util.List;

/**
 * Raised when input fails validation; carries every violation found, not just the first.
 *
 * @since 0.3.0
 */
public class ValidationException extends ProtocolException {
  private static final long serialVersionUID = 1L;

  private final List<String> violations;

  /**
   * Creates a {@link ErrorCode#VALIDATION_ERROR} failure.
   *
   * @param context what was being validated, e.g. {@code frame}
   * @param violations individual violation messages; must not be empty
   */
  public ValidationException(String context, List<String> violations) {
    this(ErrorCode.VALIDATION_ERROR, context, violations);
  }

  /**
   * Creates a validation failure tagged with a more specific code.
   *
   * @param code failure code
   * @param context what was being validated
   * @param violations individual violation messages
   */
  public ValidationException(ErrorCode code, String context, List<String> violations) {
    super(code, context + " invalid: " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  /**
   * Returns the individual violations in discovery order.
   *
   * @return immutable violation list
   */
  public List<String> violations() {
    return violations;
  }
}
