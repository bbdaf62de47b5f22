package io.xk6.prometheus.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.xk6.prometheus.application.port.MetricsPort;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards the flusher's self-telemetry to OpenTelemetry.
 * <p>Each key becomes one instrument, created on first use. The original key travels as the
 * {@code xk6.metric.key} attribute because instrument names are normalized. Keys ending in {@code _nanos}
 * are recorded with unit {@code ns}, keys mentioning samples with unit {@code {sample}}.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("xk6.metric.key");
  private static final String FALLBACK_METRIC_NAME = "xk6.exporter";
  static final int MAX_INSTRUMENT_NAME = 255;

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Bound<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Bound<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /** Uses the exporter selected through {@code otel.*} system properties or environment. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.isNoop() ? null : bootstrap.meter();
    if (meter == null) {
      log.debug("Exporter self-telemetry running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    if (meter != null) {
      Bound<LongCounter> bound = bind(counters, key, (name, unit) -> meter.counterBuilder(name)
          .setUnit(unit)
          .setDescription("Occurrences of " + key)
          .build());
      bound.instrument().add(1, bound.attributes());
    }
  }

  @Override
  public void observe(String key, long value) {
    if (meter != null) {
      Bound<LongHistogram> bound = bind(histograms, key, (name, unit) -> meter.histogramBuilder(name)
          .ofLongs()
          .setUnit(unit)
          .setDescription("Distribution of " + key)
          .build());
      bound.instrument().record(value, bound.attributes());
    }
  }

  /**
   * Whether observations are discarded.
   *
   * @return {@code true} when no exporter is active
   */
  public boolean isNoop() {
    return meter == null;
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private static <T> Bound<T> bind(
      ConcurrentMap<String, Bound<T>> cache, String key, BiFunction<String, String, T> factory) {
    Objects.requireNonNull(key, "key");
    return cache.computeIfAbsent(key, k -> new Bound<>(
        factory.apply(sanitizeName(k), unitFor(k)), Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
  }

  static String unitFor(String key) {
    String lower = key.toLowerCase(Locale.ROOT);
    if (lower.endsWith("_nanos")) {
      return "ns";
    }
    return lower.contains("samples") ? "{sample}" : "1";
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    lower.chars()
        .map(c -> Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_')
        .forEach(c -> name.append((char) c));
    return name.length() > MAX_INSTRUMENT_NAME ? name.substring(0, MAX_INSTRUMENT_NAME) : name.toString();
  }

  private record Bound<T>(T instrument, Attributes attributes) {}
}
