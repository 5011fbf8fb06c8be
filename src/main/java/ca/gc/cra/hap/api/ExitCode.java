package ca.gc.cra.hap.api;

/**
 * <strong>What:</strong> Process exit codes shared by {@code hap} commands.
 * <p><strong>Why:</strong> CI jobs gate deployments on the status, so a protocol rejection must be
 * distinguishable from bad arguments or a crash.</p>
 *
 * @since 0.3.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration or key material was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The protocol rejected the input: invalid attestation, insufficient scope, or an SDG hard stop. */
  REJECTED(6);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
