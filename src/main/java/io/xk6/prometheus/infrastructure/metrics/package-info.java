/**
 * Metric adapters: the Prometheus-backed sample catalog and the OpenTelemetry self-telemetry port.
 * <p><strong>Concurrency:</strong> Both adapters are safe for concurrent use; the catalog serializes only
 * family creation.</p>
 */
package io.xk6.prometheus.infrastructure.metrics;
