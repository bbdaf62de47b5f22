package io.xk6.prometheus.domain.sample;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Metric types declared by the k6 engine for every sample it emits.
 * <p><strong>Why:</strong> Drives how a sample is folded into exported metric state (sum, last value, or
 * distribution).</p>
 * <p><strong>Role:</strong> Domain enumeration attached to {@link Sample} as a kind hint.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum MetricKind {
  /** Cumulative sum of observed values. */
  COUNTER,
  /** Last observed value. */
  GAUGE,
  /** Ratio of non-zero observations; exported as a single-boundary distribution. */
  RATE,
  /** Statistical distribution of observations (durations, sizes). */
  TREND;

  /**
   * Parses the lowercase type name used in k6 result streams ({@code "counter"}, {@code "trend"}, ...).
   *
   * @param raw type name; {@code null} or blank yields empty
   * @return matching kind, or empty when the name is not a known k6 type
   */
  public static Optional<MetricKind> fromTypeName(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (MetricKind kind : values()) {
      if (kind.name().equals(normalized)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the lowercase name used in help strings and result streams.
   *
   * @return lowercase type name
   */
  public String typeName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
