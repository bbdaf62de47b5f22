/**
 * Ports between the flush pipeline and its adapters.
 * <p><strong>Role:</strong> Interfaces implemented in {@code io.xk6.prometheus.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Each port documents which calls may race with scrapes or producers.</p>
 */
package io.xk6.prometheus.application.port;
