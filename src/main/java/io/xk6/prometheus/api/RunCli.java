package io.xk6.prometheus.api;

import io.prometheus.client.CollectorRegistry;
import io.xk6.prometheus.config.CompositionRoot;
import io.xk6.prometheus.config.ExporterConfigException;
import io.xk6.prometheus.config.YamlConfigLoader;
import io.xk6.prometheus.infrastructure.ingest.SampleReplayer;
import io.xk6.prometheus.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.xk6.prometheus.logging.LoggingConfigurator;
import io.xk6.prometheus.validation.Numbers;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the exporter as a standalone process until interrupted.
 *
 * @since 0.1.0
 */
final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final Duration STOP_GRACE = Duration.ofSeconds(10);
  private static final Set<String> KNOWN_KEYS = Set.of("out", "config", "input", "interval");
  private static final String SUMMARY_USAGE =
      "usage: run [out=OPTIONS] [config=PATH] [input=PATH|-] [interval=MS] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelProtocol=grpc|http/protobuf] [otelInterval=MS]";
  private static final String HELP_TEXT = """
      xk6-prometheus exporter

      Usage:
        run [options]

      Optional:
        out=OPTIONS               Option string, e.g. out=port=5656&namespace=k6&subsystem=run
                                  keys: port (default 5656, 0 = ephemeral), host, namespace,
                                  subsystem, buckets (comma-separated, strictly increasing)
        config=PATH               YAML file; 'common' and 'exporter' sections supply defaults
        input=PATH|-              Replay a k6 JSON result stream (k6 run --out json=...); '-' reads stdin
        interval=MS               Flush interval in milliseconds (10-3600000, default 1000)
        metricsExporter=otlp|none Self-telemetry exporter (default none)
        otelEndpoint=URL          OTLP metrics endpoint when metricsExporter=otlp
        otelProtocol=PROTOCOL     grpc (default) or http/protobuf
        otelInterval=MS           Self-telemetry export period (1000-3600000, default 30000)
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private RunCli() {}

  static ExitCode run(String[] args) {
    CountDownLatch shutdown = new CountDownLatch(1);
    CountDownLatch stopped = new CountDownLatch(1);
    Runnable hook = () -> {
      shutdown.countDown();
      try {
        if (!stopped.await(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Exporter did not stop within {} ms", STOP_GRACE.toMillis());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    };
    try {
      return run(args, shutdown, () -> Runtime.getRuntime().addShutdownHook(
          new Thread(hook, "xk6-prometheus-shutdown")));
    } finally {
      stopped.countDown();
    }
  }

  /**
   * Executes the run command.
   *
   * @param args raw CLI arguments after the command name
   * @param shutdown released when the exporter should stop
   * @param installHook registers whatever releases {@code shutdown}
   * @return exit code
   */
  static ExitCode run(String[] args, CountDownLatch shutdown, Runnable installHook) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run command");
    }
    if (!input.unknownFlags().isEmpty()) {
      log.debug("Unknown flags: {}", input.unknownFlags());
      CliPrinter.usageError("unknown flags " + input.unknownFlags(), SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    Duration interval;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      TelemetryConfigurator.configureMetrics(kv);
      for (String key : kv.keySet()) {
        if (!KNOWN_KEYS.contains(key)) {
          throw new IllegalArgumentException("unknown argument: " + key);
        }
      }
      interval = kv.containsKey("interval")
          ? Duration.ofMillis(Numbers.parseInRange("interval", kv.get("interval"), 10, 3_600_000))
          : CompositionRoot.DEFAULT_FLUSH_INTERVAL;
    } catch (IllegalArgumentException ex) {
      log.debug("Invalid argument", ex);
      CliPrinter.usageError(ex.getMessage(), SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> fileDefaults;
    try {
      fileDefaults = loadConfigFile(kv.get("config"));
    } catch (ExporterConfigException ex) {
      log.error("Invalid configuration file: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Failed to read configuration file {}", kv.get("config"), ex);
      return ExitCode.IO_ERROR;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
        PrometheusOutput output = new PrometheusOutput(
            kv.getOrDefault("out", ""), fileDefaults, CollectorRegistry.defaultRegistry, interval, metrics)) {
      output.start();
      CliPrinter.println("Serving " + output.description() + "; press Ctrl+C to stop");
      installHook.run();
      try (SampleReplayer replayer = openReplayer(kv.get("input"), output)) {
        if (replayer != null) {
          replayer.start();
        }
        shutdown.await();
      }
      log.info("Shutting down {}", output.description());
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Exporter interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (IOException | RuntimeException ex) {
      ExitCode exit = ExitCode.forFailure(ex);
      switch (exit) {
        case CONFIG_ERROR -> log.error("Invalid exporter options: {}", ex.getMessage());
        case IO_ERROR -> log.error("Exporter I/O failure: {}", ex.getMessage(), ex);
        default -> log.error("Unexpected failure in exporter", ex);
      }
      return exit;
    }
  }

  private static Optional<Map<String, String>> loadConfigFile(String rawPath) throws IOException {
    if (rawPath == null) {
      return Optional.empty();
    }
    Path path = Path.of(rawPath);
    if (!Files.isRegularFile(path)) {
      throw new ExporterConfigException("config file not found: " + rawPath);
    }
    return YamlConfigLoader.load(path, YamlConfigLoader.EXPORTER_SECTION);
  }

  private static SampleReplayer openReplayer(String input, PrometheusOutput output) throws IOException {
    if (input == null) {
      return null;
    }
    BufferedReader reader = "-".equals(input)
        ? new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))
        : Files.newBufferedReader(Path.of(input), StandardCharsets.UTF_8);
    log.info("Replaying k6 samples from {}", "-".equals(input) ? "stdin" : input);
    return new SampleReplayer(reader, output::addSamples);
  }
}
