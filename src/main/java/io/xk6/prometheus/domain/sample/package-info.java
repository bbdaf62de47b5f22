/**
 * Sample model emitted by the load generator.
 * <p><strong>Role:</strong> Domain layer values with no infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share between producer and flush threads.</p>
 */
package io.xk6.prometheus.domain.sample;
