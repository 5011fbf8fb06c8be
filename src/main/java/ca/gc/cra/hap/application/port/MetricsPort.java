package ca.gc.cra.hap.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for protocol operations.
 * <p><strong>Why:</strong> Signer, verifier, executor, and SDG engine count outcomes without binding to a
 * vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract, e.g. {@code hap.verify.failure.expired}.</p>
 *
 * @since 0.3.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
