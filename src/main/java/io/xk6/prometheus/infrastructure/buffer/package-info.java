/**
 * Sample buffer adapters decoupling producers from the flush pipeline.
 * <p><strong>Concurrency:</strong> Multi-writer append, single-reader drain.</p>
 */
package io.xk6.prometheus.infrastructure.buffer;
