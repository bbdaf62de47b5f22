package io.xk6.prometheus.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private final Map<TelemetryConfigurator.TelemetryOption, String> saved =
      new EnumMap<>(TelemetryConfigurator.TelemetryOption.class);

  @BeforeEach
  void saveProperties() {
    for (TelemetryConfigurator.TelemetryOption option : TelemetryConfigurator.TelemetryOption.values()) {
      String previous = System.getProperty(option.property());
      if (previous != null) {
        saved.put(option, previous);
      }
      System.clearProperty(option.property());
    }
  }

  @AfterEach
  void restoreProperties() {
    for (TelemetryConfigurator.TelemetryOption option : TelemetryConfigurator.TelemetryOption.values()) {
      String previous = saved.get(option);
      if (previous == null) {
        System.clearProperty(option.property());
      } else {
        System.setProperty(option.property(), previous);
      }
    }
  }

  @Test
  void consumesTelemetryKeysAndLeavesTheRest() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4318",
        "otelProtocol", "HTTP/protobuf",
        "otelInterval", "5000",
        "out", "port=0"));

    TelemetryConfigurator.configureMetrics(args);

    assertEquals(Map.of("out", "port=0"), args);
    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4318", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("http/protobuf", System.getProperty("otel.exporter.otlp.protocol"));
    assertEquals("5000", System.getProperty("otel.metric.export.interval"));
  }

  @Test
  void invalidValueSetsNothing() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "otlp",
        "otelEndpoint", "ftp://collector"));

    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(args));
    assertNull(System.getProperty("otel.metrics.exporter"));
  }

  @Test
  void rejectsUnknownExporterProtocolAndShortInterval() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "zipkin"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelProtocol", "thrift"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelInterval", "10"))));
  }

  @Test
  void argumentNamesMatchTheUsageText() {
    assertEquals("otelEndpoint", TelemetryConfigurator.TelemetryOption.ENDPOINT.argument());
  }
}
