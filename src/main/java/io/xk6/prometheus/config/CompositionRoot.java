package io.xk6.prometheus.config;

import io.prometheus.client.CollectorRegistry;
import io.xk6.prometheus.application.pipeline.PeriodicFlusher;
import io.xk6.prometheus.application.pipeline.SampleAdapter;
import io.xk6.prometheus.application.port.ClockPort;
import io.xk6.prometheus.application.port.MetricsPort;
import io.xk6.prometheus.application.port.SampleBuffer;
import io.xk6.prometheus.application.port.ScrapeEndpoint;
import io.xk6.prometheus.domain.metric.IdentityNamer;
import io.xk6.prometheus.infrastructure.http.HttpScrapeEndpoint;
import io.xk6.prometheus.infrastructure.metrics.PrometheusMetricCatalog;
import io.xk6.prometheus.infrastructure.time.SystemClockAdapter;
import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires validated options to the catalog, adapter, flusher and scrape endpoint.
 * <p><strong>Role:</strong> The single place where application ports meet their infrastructure adapters.</p>
 * <p><strong>Thread-safety:</strong> Factory methods allocate new instances and are not synchronized; used once
 * per output start.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(1);

  private final ExporterOptions options;
  private final CollectorRegistry registry;
  private final Duration flushInterval;
  private final MetricsPort metrics;
  private final ClockPort clock;

  public CompositionRoot(
      ExporterOptions options, CollectorRegistry registry, Duration flushInterval, MetricsPort metrics) {
    this.options = Objects.requireNonNull(options, "options");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = new SystemClockAdapter();
  }

  /**
   * Builds the exporter pipeline around an existing buffer.
   *
   * @param buffer buffer producers have been appending to
   * @return unstarted components
   */
  public Pipeline pipeline(SampleBuffer buffer) {
    PrometheusMetricCatalog catalog = new PrometheusMetricCatalog(registry);
    SampleAdapter adapter = new SampleAdapter(
        catalog, new IdentityNamer(options.namespace(), options.subsystem()), options.buckets());
    PeriodicFlusher flusher = new PeriodicFlusher(buffer, adapter, flushInterval, metrics, clock);
    ScrapeEndpoint endpoint = new HttpScrapeEndpoint(registry, catalog);
    return new Pipeline(catalog, adapter, flusher, endpoint);
  }

  public ExporterOptions options() {
    return options;
  }

  /**
   * Components of one running exporter.
   *
   * @param catalog identity-to-family catalog
   * @param adapter sample classifier and applier
   * @param flusher periodic drain driver
   * @param endpoint pull endpoint
   */
  public record Pipeline(
      PrometheusMetricCatalog catalog, SampleAdapter adapter, PeriodicFlusher flusher, ScrapeEndpoint endpoint) {}
}
