package io.xk6.prometheus.application.port;

/**
 * <strong>What:</strong> Port for the exporter's own telemetry (flush timings, sample counts).
 * <p><strong>Why:</strong> Lets the flush pipeline report about itself without binding to a vendor SDK and
 * without mixing self-telemetry into the scraped workload metrics.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} discards everything.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls from flush and HTTP threads.</p>
 *
 * @implNote Keys use dotted naming (e.g., {@code exporter.flush.duration_nanos}); adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric key; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric key; must not be {@code null}
   * @param value observed value (nanoseconds, sample counts); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
