package ca.gc.cra.hap.infrastructure.time;

import ca.gc.cra.hap.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.3.0
 */
public final class SystemClockAdapter implements ClockPort {

  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Delegates to {@link System#currentTimeMillis()}; attestation times are truncated to
   *     seconds by {@link ClockPort#nowSeconds()}.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
