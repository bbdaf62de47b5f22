/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound untrusted text before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 *
 * @since 0.1.0
 */
package io.xk6.prometheus.logging;
