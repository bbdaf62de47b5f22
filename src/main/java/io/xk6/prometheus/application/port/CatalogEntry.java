package io.xk6.prometheus.application.port;

import io.xk6.prometheus.domain.metric.MetricDescriptor;

/**
 * Handle to one exported metric family held by a {@link MetricCatalog}.
 *
 * @since 0.1.0
 */
public interface CatalogEntry {
  /**
   * Fixed shape of the family.
   *
   * @return descriptor captured when the entry was created
   */
  MetricDescriptor descriptor();

  /**
   * Number of distinct label-value tuples observed so far.
   *
   * @return series count
   */
  int seriesCount();
}
