/**
 * Metrics adapters that bridge {@code hap.*} counters to OpenTelemetry or a no-op sink.
 * <p><strong>Security:</strong> Only counter names and outcome codes are exported; blobs, keys, and
 * disclosure text never become metric attributes.</p>
 */
package ca.gc.cra.hap.infrastructure.metrics;
