package ca.gc.cra.hap.infrastructure.metrics;

import ca.gc.cra.hap.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations. Used when {@code metrics.exporter=none}.
 *
 * @since 0.3.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {

  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
