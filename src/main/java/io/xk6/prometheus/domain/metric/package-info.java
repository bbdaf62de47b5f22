/**
 * Metric naming, labeling and classification rules.
 * <p><strong>Role:</strong> Domain policy shared by the sample adapter and the metric catalog.</p>
 * <p><strong>Concurrency:</strong> Values are immutable; {@link io.xk6.prometheus.domain.metric.IdentityNamer}
 * memoizes through a concurrent map.</p>
 */
package io.xk6.prometheus.domain.metric;
