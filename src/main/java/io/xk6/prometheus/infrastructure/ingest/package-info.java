/**
 * Ingest adapters turning k6 NDJSON result streams into samples for the exporter.
 */
package io.xk6.prometheus.infrastructure.ingest;
