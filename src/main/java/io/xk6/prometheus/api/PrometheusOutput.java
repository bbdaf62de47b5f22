package io.xk6.prometheus.api;

import io.prometheus.client.CollectorRegistry;
import io.xk6.prometheus.application.pipeline.PeriodicFlusher;
import io.xk6.prometheus.application.port.MetricsPort;
import io.xk6.prometheus.application.port.ScrapeEndpoint;
import io.xk6.prometheus.config.CompositionRoot;
import io.xk6.prometheus.config.ConfigMerger;
import io.xk6.prometheus.config.ExporterOptions;
import io.xk6.prometheus.config.OptionsParser;
import io.xk6.prometheus.domain.sample.Sample;
import io.xk6.prometheus.infrastructure.buffer.LockingSampleBuffer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> The {@code prometheus} output a load engine drives: buffers samples, flushes them
 * into the registry on an interval and serves them to scrapers.
 * <p><strong>Lifecycle:</strong> Construction only records the option string. {@link #start()} parses it, binds
 * the listener and starts the flusher; configuration errors surface before anything is bound. {@link #stop()}
 * stops the flusher (with a final flush) and releases the listener; it is idempotent and a no-op before
 * start.</p>
 * <p><strong>Thread-safety:</strong> {@link #addSamples(Collection)} may be called from any thread at any time;
 * lifecycle calls are serialized.</p>
 *
 * @since 0.1.0
 */
public final class PrometheusOutput implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PrometheusOutput.class);

  private enum Phase { NEW, STARTED, STOPPED }

  private final String argument;
  private final Optional<Map<String, String>> fileDefaults;
  private final CollectorRegistry registry;
  private final Duration flushInterval;
  private final MetricsPort metrics;
  private final LockingSampleBuffer buffer = new LockingSampleBuffer();
  private final Object lifecycle = new Object();

  private Phase phase = Phase.NEW;
  private volatile String address = "";
  private ExporterOptions options;
  private CompositionRoot.Pipeline pipeline;

  /**
   * Creates an output registering its families with the process-wide default registry.
   *
   * @param argument option string such as {@code port=5656&namespace=k6}; may be empty
   */
  public PrometheusOutput(String argument) {
    this(argument, CollectorRegistry.defaultRegistry);
  }

  /**
   * Creates an output writing into the given registry.
   *
   * @param argument option string; may be empty
   * @param registry registry shared with any in-process readers
   */
  public PrometheusOutput(String argument, CollectorRegistry registry) {
    this(argument, Optional.empty(), registry, CompositionRoot.DEFAULT_FLUSH_INTERVAL, MetricsPort.NO_OP);
  }

  /**
   * Creates a fully configured output.
   *
   * @param argument option string; its keys override {@code fileDefaults}
   * @param fileDefaults option defaults loaded from a YAML file
   * @param registry registry the catalog writes into
   * @param flushInterval flush tick interval
   * @param metrics self-telemetry sink
   */
  public PrometheusOutput(
      String argument,
      Optional<Map<String, String>> fileDefaults,
      CollectorRegistry registry,
      Duration flushInterval,
      MetricsPort metrics) {
    this.argument = argument == null ? "" : argument;
    this.fileDefaults = Objects.requireNonNull(fileDefaults, "fileDefaults");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Human-readable description shown by the engine.
   *
   * @return {@code prometheus (<host>:<port>)}; the address is empty before start
   */
  public String description() {
    return "prometheus (" + address + ")";
  }

  /**
   * Parses options, binds the scrape endpoint and starts the flusher.
   *
   * @throws io.xk6.prometheus.config.ExporterConfigException when the option string is invalid
   * @throws IOException when the listener cannot be bound
   * @throws IllegalStateException when already started or stopped
   */
  public void start() throws IOException {
    synchronized (lifecycle) {
      if (phase != Phase.NEW) {
        throw new IllegalStateException("Output already " + phase.name().toLowerCase(Locale.ROOT));
      }
      Map<String, String> effective = ConfigMerger.buildEffectiveOptions(
          fileDefaults, OptionsParser.parseQuery(argument), log::warn);
      ExporterOptions parsed = OptionsParser.fromMap(effective);
      CompositionRoot.Pipeline built =
          new CompositionRoot(parsed, registry, flushInterval, metrics).pipeline(buffer);

      ScrapeEndpoint endpoint = built.endpoint();
      InetSocketAddress bound = endpoint.start(parsed.host(), parsed.port());
      try {
        built.flusher().start();
      } catch (RuntimeException ex) {
        endpoint.stop();
        throw ex;
      }
      options = parsed;
      pipeline = built;
      address = parsed.host() + ":" + bound.getPort();
      phase = Phase.STARTED;
      log.info("Started {} with namespace '{}' subsystem '{}'", description(), parsed.namespace(), parsed.subsystem());
    }
  }

  /**
   * Stops the flusher, applying any still-buffered samples, then releases the listener.
   * <p>Idempotent; returns immediately when the output was never started.</p>
   */
  public void stop() {
    synchronized (lifecycle) {
      if (phase != Phase.STARTED) {
        return;
      }
      phase = Phase.STOPPED;
      try {
        pipeline.flusher().stop();
      } finally {
        pipeline.endpoint().stop();
      }
      log.info("Stopped {}", description());
    }
  }

  @Override
  public void close() {
    stop();
  }

  /**
   * Appends samples to the buffer; never blocks on flushing or scraping.
   *
   * @param samples batch to append; {@code null} or empty is a no-op
   */
  public void addSamples(Collection<Sample> samples) {
    buffer.addSamples(samples);
  }

  /**
   * Registry the output writes into.
   *
   * @return backing registry
   */
  public CollectorRegistry registry() {
    return registry;
  }

  /**
   * Options in effect once started.
   *
   * @return parsed options, empty before start
   */
  public Optional<ExporterOptions> options() {
    synchronized (lifecycle) {
      return Optional.ofNullable(options);
    }
  }

  Optional<PeriodicFlusher> flusher() {
    synchronized (lifecycle) {
      return Optional.ofNullable(pipeline).map(CompositionRoot.Pipeline::flusher);
    }
  }
}
