package io.xk6.prometheus.domain.metric;

import io.xk6.prometheus.domain.sample.MetricKind;
import io.xk6.prometheus.domain.sample.Sample;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Determines the k6 metric type of a sample.
 * <p>An explicit kind on the sample wins; otherwise the k6 built-in table is consulted, then naming
 * conventions. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class KindClassifier {
  private static final List<String> COUNTER_SUFFIXES = List.of("_total", "_count", "_reqs");
  private static final List<String> TREND_SUFFIXES = List.of("_duration", "_time", "_latency");
  private static final List<String> RATE_SUFFIXES = List.of("_rate", "_failed");
  private static final List<String> GAUGE_SUFFIXES = List.of("_current", "_max", "_vus");

  private KindClassifier() {}

  /**
   * Classifies a sample.
   *
   * @param sample sample to classify
   * @return declared or inferred kind
   * @throws SampleClassificationException when no kind is declared and none can be inferred
   */
  public static MetricKind classify(Sample sample) {
    return sample.kindHint()
        .or(() -> infer(sample.name()))
        .orElseThrow(() -> new SampleClassificationException(
            sample.name(), "kind", "metric type is unknown and cannot be inferred from the name"));
  }

  /**
   * Infers a kind from a metric name alone.
   *
   * @param name logical metric name
   * @return inferred kind, or empty when the name follows no known convention
   */
  public static Optional<MetricKind> infer(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    Optional<BuiltinMetric> builtin = BuiltinMetric.byName(name);
    if (builtin.isPresent()) {
      return builtin.map(BuiltinMetric::kind);
    }
    String lower = name.trim().toLowerCase(Locale.ROOT);
    if (endsWithAny(lower, COUNTER_SUFFIXES)) {
      return Optional.of(MetricKind.COUNTER);
    }
    if (endsWithAny(lower, TREND_SUFFIXES)) {
      return Optional.of(MetricKind.TREND);
    }
    if (endsWithAny(lower, RATE_SUFFIXES) || lower.equals("checks")) {
      return Optional.of(MetricKind.RATE);
    }
    if (endsWithAny(lower, GAUGE_SUFFIXES) || lower.equals("vus")) {
      return Optional.of(MetricKind.GAUGE);
    }
    return Optional.empty();
  }

  private static boolean endsWithAny(String value, List<String> suffixes) {
    for (String suffix : suffixes) {
      if (value.endsWith(suffix)) {
        return true;
      }
    }
    return false;
  }
}
