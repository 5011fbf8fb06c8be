package ca.gc.cra.hap.domain.error;

import java.util.Objects;

/**
 * Unchecked failure raised by protocol operations, tagged with a stable {@link ErrorCode}.
 *
 * <p>Callers that wrap a {@code ProtocolException} should keep it as the cause so that
 * {@link #codeOf(Throwable)} can still recover the original code.</p>
 *
 * @since 0.3.0
 */
public class ProtocolException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorCode code;

  /**
   * Creates an exception with the given code and message.
   *
   * @param code failure code; never {@code null}
   * @param message human readable detail
   */
  public ProtocolException(ErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
  }

  /**
   * Creates an exception with the given code, message, and cause.
   *
   * @param code failure code; never {@code null}
   * @param message human readable detail
   * @param cause underlying failure
   */
  public ProtocolException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  /**
   * Returns the failure code.
   *
   * @return stable error code
   */
  public ErrorCode code() {
    return code;
  }

  /**
   * Finds the first {@link ProtocolException} in the cause chain and returns its code.
   *
   * @param error throwable to inspect; may be {@code null}
   * @return code of the nearest protocol failure, or {@code null} when none is present
   */
  public static ErrorCode codeOf(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth++ < 32) {
      if (current instanceof ProtocolException protocol) {
        return protocol.code();
      }
      current = current.getCause();
    }
    return null;
  }
}
