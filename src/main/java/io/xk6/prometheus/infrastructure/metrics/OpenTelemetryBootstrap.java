package io.xk6.prometheus.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.http.metrics.OtlpHttpMetricExporter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricExporter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the meter provider behind the exporter's self-telemetry.
 * <p>Settings follow the OpenTelemetry SDK names, system property first and environment variable second:</p>
 * <ul>
 *   <li>{@code otel.metrics.exporter}: {@code otlp} or {@code none} (default)</li>
 *   <li>{@code otel.exporter.otlp.endpoint}: collector URL</li>
 *   <li>{@code otel.exporter.otlp.protocol}: {@code grpc} (default) or {@code http/protobuf}</li>
 *   <li>{@code otel.metric.export.interval}: export period in milliseconds (default 30000)</li>
 * </ul>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "io.xk6.prometheus";
  static final String SERVICE_NAME = "xk6-prometheus";
  private static final Duration DEFAULT_EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);

  private OpenTelemetryBootstrap() {
    // Utility
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> {
          log.warn("Unknown metrics exporter '{}'; self-telemetry disabled", raw);
          yield NONE;
        }
      };
    }
  }

  /**
   * Resolved self-telemetry settings.
   *
   * @param mode exporter selection
   * @param endpoint collector URL
   * @param httpProtocol {@code true} for OTLP over HTTP/protobuf, {@code false} for gRPC
   * @param interval export period
   */
  record Settings(ExporterMode mode, String endpoint, boolean httpProtocol, Duration interval) {

    /**
     * Reads settings through {@code lookup}, which maps an SDK property name to its value or {@code null}.
     *
     * @param lookup property source
     * @return settings with defaults applied
     */
    static Settings resolve(UnaryOperator<String> lookup) {
      ExporterMode mode = ExporterMode.from(lookup.apply("otel.metrics.exporter"));
      String protocol = valueOr(lookup.apply("otel.exporter.otlp.protocol"), "grpc").toLowerCase(Locale.ROOT);
      boolean http = protocol.startsWith("http");
      String endpoint = valueOr(lookup.apply("otel.exporter.otlp.endpoint"),
          http ? "http://localhost:4318" : "http://localhost:4317");
      return new Settings(mode, endpoint, http, interval(lookup.apply("otel.metric.export.interval")));
    }

    private static Duration interval(String raw) {
      if (raw == null || raw.isBlank()) {
        return DEFAULT_EXPORT_INTERVAL;
      }
      try {
        long millis = Long.parseLong(raw.trim());
        if (millis > 0) {
          return Duration.ofMillis(millis);
        }
      } catch (NumberFormatException ex) {
        log.debug("Export interval '{}' is not a number", raw, ex);
      }
      log.warn("Ignoring invalid otel.metric.export.interval '{}'; using {} ms",
          raw, DEFAULT_EXPORT_INTERVAL.toMillis());
      return DEFAULT_EXPORT_INTERVAL;
    }

    private static String valueOr(String value, String fallback) {
      return value == null || value.isBlank() ? fallback : value.trim();
    }
  }

  static BootstrapResult initialize() {
    return initialize(Settings.resolve(OpenTelemetryBootstrap::systemLookup));
  }

  static BootstrapResult initialize(Settings settings) {
    if (settings.mode() == ExporterMode.NONE) {
      return BootstrapResult.noop();
    }
    try {
      MetricExporter exporter = settings.httpProtocol()
          ? OtlpHttpMetricExporter.builder().setEndpoint(settings.endpoint()).build()
          : OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(settings.interval()).build();
      BootstrapResult result = build(reader);
      log.info("Self-telemetry exporting over OTLP/{} to {} every {} ms",
          settings.httpProtocol() ? "http" : "grpc", settings.endpoint(), settings.interval().toMillis());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; self-telemetry disabled", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
        AttributeKey.stringKey("service.name"), SERVICE_NAME,
        AttributeKey.stringKey("service.version"), version)));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new BootstrapResult(meter, provider);
  }

  private static String systemLookup(String property) {
    String value = System.getProperty(property);
    if (value != null && !value.isBlank()) {
      return value;
    }
    return System.getenv(property.toUpperCase(Locale.ROOT).replace('.', '_'));
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.0.0-dev" : version;
  }

  /** Meter plus the provider that owns it; the provider is {@code null} in noop mode. */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String action) {
      result.join(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within {} ms", action, SHUTDOWN_WAIT.toMillis());
      }
    }
  }
}
