package io.xk6.prometheus.domain.metric;

/**
 * Shape of an exported metric family as seen by scrapers.
 *
 * @since 0.1.0
 */
public enum ExportKind {
  /** Monotonic total per series. */
  COUNTER,
  /** Last written value per series. */
  GAUGE,
  /** Cumulative bucket counts plus sum and count per series. */
  DISTRIBUTION
}
