package ca.gc.cra.hap.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("hap.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void verifyFailuresBecomeCounters() {
    adapter.increment("hap.verify.failure.expired");
    adapter.increment("hap.verify.failure.expired");
    adapter.flush();

    MetricData counter = find(reader.collectAllMetrics(), "hap.verify.failure.expired");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("hap.verify.failure.expired", point.getAttributes().get(METRIC_KEY));
    assertEquals("hap", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observationsBecomeHistograms() {
    adapter.observe("hap.authorize.scopes", 1);
    adapter.observe("hap.authorize.scopes", 3);

    MetricData histogram = find(reader.collectAllMetrics(), "hap.authorize.scopes");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4.0, point.getSum());
  }

  @Test
  void keysAreSanitizedButKeptAsAttribute() {
    adapter.increment("HAP Sign/Success");

    MetricData counter = find(reader.collectAllMetrics(), "hap_sign_success");
    assertEquals("HAP Sign/Success",
        counter.getLongSumData().getPoints().iterator().next().getAttributes().get(METRIC_KEY));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitize("9lives"));
    assertEquals("hap.metric", OpenTelemetryMetricsAdapter.sanitize("  "));
  }

  @Test
  void testAdapterIsActive() {
    assertFalse(adapter.isNoop());
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported"));
  }
}
