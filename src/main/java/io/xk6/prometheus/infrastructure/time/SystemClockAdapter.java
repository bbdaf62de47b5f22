package io.xk6.prometheus.infrastructure.time;

import io.xk6.prometheus.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * Returns the JVM's monotonic nanosecond reading.
   *
   * @return current nanoTime value
   * @implNote Delegates to {@link System#nanoTime()}; not related to wall-clock time.
   */
  @Override
  public long nanoTime() {
    return System.nanoTime();
  }
}
