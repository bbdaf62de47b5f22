package io.xk6.prometheus.api;

import io.xk6.prometheus.validation.Numbers;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies self-telemetry arguments of the {@code run} command into the OpenTelemetry system properties
 * that the metrics bootstrap reads.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  /** Command-line keys and the SDK property each one sets. */
  enum TelemetryOption {
    EXPORTER("metricsExporter", "otel.metrics.exporter", TelemetryConfigurator::exporter),
    ENDPOINT("otelEndpoint", "otel.exporter.otlp.endpoint", TelemetryConfigurator::endpoint),
    PROTOCOL("otelProtocol", "otel.exporter.otlp.protocol", TelemetryConfigurator::protocol),
    INTERVAL("otelInterval", "otel.metric.export.interval", TelemetryConfigurator::interval);

    private final String argument;
    private final String property;
    private final UnaryOperator<String> normalizer;

    TelemetryOption(String argument, String property, UnaryOperator<String> normalizer) {
      this.argument = argument;
      this.property = property;
      this.normalizer = normalizer;
    }

    String argument() {
      return argument;
    }

    String property() {
      return property;
    }
  }

  private TelemetryConfigurator() {}

  /**
   * Removes every telemetry key from {@code args} and publishes its normalized value.
   *
   * @param args mutable CLI map
   * @throws IllegalArgumentException when a value is invalid; no property is set in that case
   */
  static void configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return;
    }
    Map<TelemetryOption, String> resolved = new EnumMap<>(TelemetryOption.class);
    for (TelemetryOption option : TelemetryOption.values()) {
      String raw = args.remove(option.argument);
      if (raw != null) {
        resolved.put(option, option.normalizer.apply(raw.trim()));
      }
    }
    resolved.forEach((option, value) -> {
      log.debug("Self-telemetry {} = {}", option.property, value);
      System.setProperty(option.property, value);
    });
  }

  private static String exporter(String raw) {
    String normalized = raw.toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return normalized;
  }

  private static String protocol(String raw) {
    String normalized = raw.toLowerCase(Locale.ROOT);
    if (!normalized.equals("grpc") && !normalized.equals("http/protobuf")) {
      throw new IllegalArgumentException("otelProtocol must be 'grpc' or 'http/protobuf'");
    }
    return normalized;
  }

  private static String interval(String raw) {
    return Long.toString(Numbers.parseInRange("otelInterval", raw, 1_000, 3_600_000));
  }

  private static String endpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
    return raw;
  }
}
