package ca.gc.cra.hap.domain.profile;

import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;

/**
 * Protocol generations understood by this implementation.
 *
 * <p>{@code 0.2} binds a single disclosure hash into the frame; {@code 0.3} moves disclosure hashes
 * into per-domain attestations.</p>
 *
 * @since 0.3.0
 */
public enum ProtocolVersion {
  V0_2("0.2"),
  V0_3("0.3");

  private final String wire;

  ProtocolVersion(String wire) {
    this.wire = wire;
  }

  /**
   * Returns the textual form carried in payloads.
   *
   * @return version string such as {@code 0.3}
   */
  public String wire() {
    return wire;
  }

  /**
   * Parses the textual version carried in payloads.
   *
   * @param value wire form
   * @return matching version
   * @throws ProtocolException with {@link ErrorCode#MALFORMED_ATTESTATION} for unknown versions
   */
  public static ProtocolVersion fromWire(String value) {
    for (ProtocolVersion version : values()) {
      if (version.wire.equals(value)) {
        return version;
      }
    }
    throw new ProtocolException(ErrorCode.MALFORMED_ATTESTATION, "unsupported version: " + value);
  }

  @Override
  public String toString() {
    return wire;
  }
}
