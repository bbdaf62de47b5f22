/**
 * Exporter option parsing, YAML defaults and composition root wiring.
 * <p><strong>Concurrency:</strong> Option records are immutable; safe to share.</p>
 * <p><strong>Errors:</strong> Invalid input raises {@link io.xk6.prometheus.config.ExporterConfigException}
 * before any listener or timer is created.</p>
 */
package io.xk6.prometheus.config;
