package ca.gc.cra.hap.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void configuredNoneWins() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "otlp");

    try (OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize("none")) {
      assertTrue(result.isNoop(), "configuration should override the system property");
    }
  }

  @Test
  void unknownExporterDisablesMetrics() {
    previousExporter = System.getProperty("otel.metrics.exporter");

    try (OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize("prometheus")) {
      assertTrue(result.isNoop());
    }
  }

  @Test
  void noopAdapterAcceptsUpdates() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter("none")) {
      adapter.increment("hap.sign.success");
      adapter.observe("hap.sign.ttl", 60);
      adapter.flush();
      assertTrue(adapter.isNoop());
    }
    new NoOpMetricsAdapter().increment("hap.sign.success");
  }
}
