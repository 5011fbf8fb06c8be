package ca.gc.cra.hap.domain.error;

import ca.gc.cra.hap.domain.profile.ScopeRequirement;
import java.util.List;

/**
 * Raised when attested scopes leave at least one requirement of an execution path uncovered.
 *
 * @since 0.3.0
 */
public class ScopeInsufficientException extends ProtocolException {
  private static final long serialVersionUID = 1L;

  private final String executionPath;
  private final transient List<ScopeRequirement> missing;

  /**
   * Creates the failure.
   *
   * @param executionPath path whose requirements were not met
   * @param missing uncovered requirements
   */
  public ScopeInsufficientException(String executionPath, List<ScopeRequirement> missing) {
    super(ErrorCode.SCOPE_INSUFFICIENT,
        "execution path " + executionPath + " missing scopes " + missing);
    this.executionPath = executionPath;
    this.missing = List.copyOf(missing);
  }

  public String executionPath() {
    return executionPath;
  }

  public List<ScopeRequirement> missing() {
    return missing;
  }
}
