package io.xk6.prometheus.domain.metric;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable shape of one exported metric family.
 * <p><strong>Why:</strong> The catalog fixes kind, label names and bucket layout on first sight of an identity;
 * later samples are checked against this shape.</p>
 * <p><strong>Thread-safety:</strong> Immutable; lists are copied.</p>
 *
 * @param identity exported metric name after prefixing and sanitizing; never {@code null}
 * @param kind exported family kind; never {@code null}
 * @param labelNames ordered label names; never {@code null}
 * @param buckets upper bucket boundaries for distributions; empty for other kinds
 * @param help description published with the family
 * @since 0.1.0
 */
public record MetricDescriptor(
    String identity,
    ExportKind kind,
    List<String> labelNames,
    List<Double> buckets,
    String help) {

  public MetricDescriptor {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(kind, "kind");
    labelNames = List.copyOf(Objects.requireNonNull(labelNames, "labelNames"));
    buckets = buckets == null ? List.of() : List.copyOf(buckets);
    help = help == null || help.isBlank() ? identity : help;
  }

  /**
   * Checks whether another descriptor describes the same family layout.
   * <p>Help text is ignored; kind, label names and bucket layout must match exactly.</p>
   *
   * @param other descriptor requested by a later sample
   * @return {@code true} when both descriptors can share one family
   */
  public boolean sameShape(MetricDescriptor other) {
    return other != null
        && identity.equals(other.identity)
        && kind == other.kind
        && labelNames.equals(other.labelNames)
        && buckets.equals(other.buckets);
  }
}
