package io.xk6.prometheus.infrastructure.metrics;

import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.xk6.prometheus.application.port.CatalogEntry;
import io.xk6.prometheus.application.port.MetricCatalog;
import io.xk6.prometheus.domain.metric.MetricDescriptor;
import io.xk6.prometheus.domain.metric.SampleClassificationException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetricCatalog} backed by a Prometheus {@link CollectorRegistry}.
 * <p><strong>What:</strong> Lazily creates one simpleclient collector per identity and registers it with the
 * registry the scrape handler reads.</p>
 * <p><strong>Why:</strong> Keeps family shape (kind, label names, buckets) fixed for the process lifetime so a
 * scrape never sees two families competing for the same name.</p>
 * <p><strong>Thread-safety:</strong> Identity lookups take the read lock; only creation of a new identity takes
 * the write lock. Cell updates use the collector children's own atomics.</p>
 *
 * @since 0.1.0
 */
public final class PrometheusMetricCatalog implements MetricCatalog {
  private static final Logger log = LoggerFactory.getLogger(PrometheusMetricCatalog.class);

  private final CollectorRegistry registry;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Entry> entries = new HashMap<>();

  /**
   * Creates a catalog registering its families with the given registry.
   *
   * @param registry registry shared with the scrape handler
   */
  public PrometheusMetricCatalog(CollectorRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  @Override
  public CatalogEntry resolve(MetricDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    String identity = descriptor.identity();
    lock.readLock().lock();
    try {
      Entry existing = entries.get(identity);
      if (existing != null) {
        return checkShape(existing, descriptor);
      }
    } finally {
      lock.readLock().unlock();
    }

    lock.writeLock().lock();
    try {
      Entry existing = entries.get(identity);
      if (existing != null) {
        return checkShape(existing, descriptor);
      }
      Entry created = create(descriptor);
      entries.put(identity, created);
      log.debug("Registered {} family {} with labels {}", descriptor.kind(), identity, descriptor.labelNames());
      return created;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public void observe(CatalogEntry entry, List<String> labelValues, double value) {
    if (!(entry instanceof Entry target)) {
      throw new IllegalArgumentException("Entry was not created by this catalog");
    }
    MetricDescriptor descriptor = target.descriptor();
    List<String> values = List.copyOf(Objects.requireNonNull(labelValues, "labelValues"));
    if (values.size() != descriptor.labelNames().size()) {
      throw new SampleClassificationException(descriptor.identity(), "labels",
          "expected " + descriptor.labelNames().size() + " label values but got " + values.size());
    }
    String[] cell = values.toArray(new String[0]);
    switch (descriptor.kind()) {
      case COUNTER -> {
        if (Double.isNaN(value) || value < 0 || Double.isInfinite(value)) {
          throw new SampleClassificationException(descriptor.identity(), "value",
              "counter increment must be a finite non-negative number but was " + value);
        }
        ((CounterFamily) target.collector).inc(values, value);
      }
      case GAUGE -> ((Gauge) target.collector).labels(cell).set(value);
      case DISTRIBUTION -> {
        if (!Double.isFinite(value)) {
          throw new SampleClassificationException(descriptor.identity(), "value",
              "distribution observation must be finite but was " + value);
        }
        ((Histogram) target.collector).labels(cell).observe(value);
      }
      default -> throw new IllegalStateException("Unhandled kind " + descriptor.kind());
    }
    target.series.add(values);
  }

  @Override
  public Optional<CatalogEntry> find(String identity) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(entries.get(identity));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<CatalogEntry> entries() {
    lock.readLock().lock();
    try {
      List<CatalogEntry> snapshot = new ArrayList<>(entries.values());
      snapshot.sort((a, b) -> a.descriptor().identity().compareTo(b.descriptor().identity()));
      return List.copyOf(snapshot);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Registry the catalog writes into.
   *
   * @return backing registry
   */
  public CollectorRegistry registry() {
    return registry;
  }

  private static Entry checkShape(Entry existing, MetricDescriptor requested) {
    MetricDescriptor known = existing.descriptor();
    if (known.sameShape(requested)) {
      return existing;
    }
    if (known.kind() != requested.kind()) {
      throw new SampleClassificationException(known.identity(), "kind",
          "already registered as " + known.kind() + ", sample maps to " + requested.kind());
    }
    if (!known.labelNames().equals(requested.labelNames())) {
      throw new SampleClassificationException(known.identity(), "labels",
          "already registered with labels " + known.labelNames() + ", sample has " + requested.labelNames());
    }
    throw new SampleClassificationException(known.identity(), "buckets",
        "already registered with buckets " + known.buckets());
  }

  private Entry create(MetricDescriptor descriptor) {
    String[] labelNames = descriptor.labelNames().toArray(new String[0]);
    Collector collector;
    try {
      collector = switch (descriptor.kind()) {
        case COUNTER -> new CounterFamily(descriptor.identity(), descriptor.help(), descriptor.labelNames());
        case GAUGE -> Gauge.build()
            .name(descriptor.identity())
            .help(descriptor.help())
            .labelNames(labelNames)
            .create();
        case DISTRIBUTION -> Histogram.build()
            .name(descriptor.identity())
            .help(descriptor.help())
            .labelNames(labelNames)
            .buckets(descriptor.buckets().stream().mapToDouble(Double::doubleValue).toArray())
            .create();
      };
      registry.register(collector);
    } catch (IllegalArgumentException | IllegalStateException ex) {
      throw new SampleClassificationException(descriptor.identity(), "identity",
          "registry refused family: " + ex.getMessage());
    }
    return new Entry(descriptor, collector);
  }

  private static final class Entry implements CatalogEntry {
    private final MetricDescriptor descriptor;
    private final Collector collector;
    private final Set<List<String>> series = ConcurrentHashMap.newKeySet();

    private Entry(MetricDescriptor descriptor, Collector collector) {
      this.descriptor = descriptor;
      this.collector = collector;
    }

    @Override
    public MetricDescriptor descriptor() {
      return descriptor;
    }

    @Override
    public int seriesCount() {
      return series.size();
    }
  }
}
