/**
 * Flush pipeline: periodic buffer draining and sample-to-metric adaptation.
 * <p><strong>Role:</strong> Application layer orchestrating buffer, catalog and self-telemetry ports.</p>
 * <p><strong>Concurrency:</strong> Flushes are serialized by {@link io.xk6.prometheus.application.pipeline.PeriodicFlusher};
 * the adapter itself is not meant to run concurrently with itself.</p>
 * <p><strong>Metrics:</strong> Emits {@code exporter.flush.*} and {@code exporter.samples.*} through the metrics port.</p>
 */
package io.xk6.prometheus.application.pipeline;
