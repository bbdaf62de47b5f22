/**
 * Executor helpers configuring named daemon threads for flush ticks, flush work and HTTP handling.
 */
package io.xk6.prometheus.infrastructure.exec;
