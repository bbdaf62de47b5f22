package io.xk6.prometheus.application.port;

/**
 * <strong>What:</strong> Port supplying a monotonic time source for flush duration measurement.
 * <p><strong>Why:</strong> Tests inject deterministic clocks to exercise overrun reporting.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see io.xk6.prometheus.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns a monotonic timestamp in nanoseconds with an arbitrary origin.
   *
   * @return nanoseconds; only differences between two readings are meaningful
   */
  long nanoTime();
}
