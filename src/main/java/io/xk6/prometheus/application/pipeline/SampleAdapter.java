package io.xk6.prometheus.application.pipeline;

import io.xk6.prometheus.application.port.ApplyResult;
import io.xk6.prometheus.application.port.CatalogEntry;
import io.xk6.prometheus.application.port.MetricCatalog;
import io.xk6.prometheus.application.port.SampleBatchHandler;
import io.xk6.prometheus.domain.metric.BuiltinMetric;
import io.xk6.prometheus.domain.metric.ExportKind;
import io.xk6.prometheus.domain.metric.IdentityNamer;
import io.xk6.prometheus.domain.metric.KindClassifier;
import io.xk6.prometheus.domain.metric.LabelSet;
import io.xk6.prometheus.domain.metric.MetricDescriptor;
import io.xk6.prometheus.domain.metric.SampleClassificationException;
import io.xk6.prometheus.domain.sample.MetricKind;
import io.xk6.prometheus.domain.sample.Sample;
import io.xk6.prometheus.logging.Logs;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds sample batches into the metric catalog.
 * <p>For every sample the adapter computes the exported identity, classifies the k6 metric type, resolves the
 * catalog entry and applies the observation. k6 types map onto exported families as follows:</p>
 * <ul>
 *   <li>counter: counter, value added</li>
 *   <li>gauge: gauge, value set</li>
 *   <li>rate: distribution with the single boundary {@code 0}</li>
 *   <li>trend: distribution with the configured boundaries plus a {@code <name>_current} gauge</li>
 * </ul>
 * <p>Malformed samples are logged and skipped; a batch is never aborted. Not designed for concurrent
 * {@link #apply} calls; the flusher serializes them.</p>
 *
 * @since 0.1.0
 */
public final class SampleAdapter implements SampleBatchHandler {
  private static final Logger log = LoggerFactory.getLogger(SampleAdapter.class);
  private static final List<Double> RATE_BUCKETS = List.of(0.0d);
  private static final String CURRENT_SUFFIX = "_current";
  private static final int LOG_NAME_BYTES = 128;
  private static final int LOG_MESSAGE_BYTES = 512;

  private final MetricCatalog catalog;
  private final IdentityNamer namer;
  private final List<Double> trendBuckets;

  /**
   * Creates an adapter.
   *
   * @param catalog catalog receiving resolved families and observations
   * @param namer identity policy (namespace/subsystem prefixing)
   * @param trendBuckets strictly increasing bucket boundaries used for trend distributions
   */
  public SampleAdapter(MetricCatalog catalog, IdentityNamer namer, List<Double> trendBuckets) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.namer = Objects.requireNonNull(namer, "namer");
    this.trendBuckets = List.copyOf(Objects.requireNonNull(trendBuckets, "trendBuckets"));
    if (this.trendBuckets.isEmpty()) {
      throw new IllegalArgumentException("trendBuckets must not be empty");
    }
  }

  @Override
  public ApplyResult apply(List<Sample> samples) {
    if (samples == null || samples.isEmpty()) {
      return ApplyResult.EMPTY;
    }
    int applied = 0;
    int dropped = 0;
    for (Sample sample : samples) {
      if (sample == null) {
        dropped++;
        continue;
      }
      try {
        applySample(sample);
        applied++;
      } catch (SampleClassificationException ex) {
        dropped++;
        log.warn("Dropping sample for {} ({}): {}",
            Logs.safe(ex.identity(), LOG_NAME_BYTES), ex.field(), Logs.safe(ex.getMessage(), LOG_MESSAGE_BYTES));
      }
    }
    return new ApplyResult(applied, dropped);
  }

  private void applySample(Sample sample) {
    MetricKind kind = KindClassifier.classify(sample);
    String identity = namer.identity(sample.name());
    LabelSet labels = LabelSet.fromTags(identity, sample.tags());
    switch (kind) {
      case COUNTER -> observe(identity, ExportKind.COUNTER, labels, List.of(),
          BuiltinMetric.helpFor(sample.name(), kind, null), sample.value());
      case GAUGE -> observe(identity, ExportKind.GAUGE, labels, List.of(),
          BuiltinMetric.helpFor(sample.name(), kind, null), sample.value());
      case RATE -> observe(identity, ExportKind.DISTRIBUTION, labels, RATE_BUCKETS,
          BuiltinMetric.helpFor(sample.name(), kind, null), sample.value());
      case TREND -> {
        // both families resolve before either is touched so a refused gauge leaves the distribution as it was
        CatalogEntry distribution = resolve(identity, ExportKind.DISTRIBUTION, labels, trendBuckets,
            BuiltinMetric.helpFor(sample.name(), kind, null));
        CatalogEntry current = resolve(namer.identity(sample.name() + CURRENT_SUFFIX), ExportKind.GAUGE, labels,
            List.of(), BuiltinMetric.helpFor(sample.name(), kind, "current"));
        catalog.observe(distribution, labels.values(), sample.value());
        catalog.observe(current, labels.values(), sample.value());
      }
      default -> throw new SampleClassificationException(identity, "kind", "unsupported metric type " + kind);
    }
  }

  private void observe(
      String identity, ExportKind kind, LabelSet labels, List<Double> buckets, String help, double value) {
    catalog.observe(resolve(identity, kind, labels, buckets, help), labels.values(), value);
  }

  private CatalogEntry resolve(
      String identity, ExportKind kind, LabelSet labels, List<Double> buckets, String help) {
    return catalog.resolve(new MetricDescriptor(identity, kind, labels.names(), buckets, help));
  }

  /**
   * Identity policy in use.
   *
   * @return namer applied to every sample name
   */
  public IdentityNamer namer() {
    return namer;
  }
}
