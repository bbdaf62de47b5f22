package io.xk6.prometheus.application.port;

import io.xk6.prometheus.domain.metric.MetricDescriptor;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Port mapping metric identities to typed, lazily created exported families.
 * <p><strong>Why:</strong> Metric names arrive at runtime, while the scrape registry needs stable pre-typed
 * families; the catalog reconciles both.</p>
 * <p><strong>Role:</strong> Written by the sample adapter during flushes, read by scrapes and diagnostics.</p>
 * <p><strong>Thread-safety:</strong> {@link #resolve} and {@link #observe} must be safe against concurrent
 * {@link #entries()} calls and registry serialization.</p>
 *
 * @since 0.1.0
 */
public interface MetricCatalog {
  /**
   * Returns the entry for {@code descriptor.identity()}, creating and registering it on first sight.
   *
   * @param descriptor requested family shape
   * @return existing or newly created entry
   * @throws io.xk6.prometheus.domain.metric.SampleClassificationException when the identity exists with a
   *     different shape or the registry refuses the family
   */
  CatalogEntry resolve(MetricDescriptor descriptor);

  /**
   * Applies one observation to the cell addressed by {@code labelValues}.
   *
   * @param entry entry obtained from {@link #resolve}
   * @param labelValues values aligned with the entry's label names
   * @param value observed value
   * @throws io.xk6.prometheus.domain.metric.SampleClassificationException for negative counter increments,
   *     non-finite counter or distribution values, or misaligned label values
   */
  void observe(CatalogEntry entry, List<String> labelValues, double value);

  /**
   * Looks up an existing entry without creating one.
   *
   * @param identity exported family name
   * @return the entry, or empty when the identity has not been resolved yet
   */
  Optional<CatalogEntry> find(String identity);

  /**
   * Snapshot of all entries, ordered by identity.
   *
   * @return immutable entry list
   */
  List<CatalogEntry> entries();
}
