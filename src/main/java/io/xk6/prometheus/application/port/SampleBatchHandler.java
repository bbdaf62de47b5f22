package io.xk6.prometheus.application.port;

import io.xk6.prometheus.domain.sample.Sample;
import java.util.List;

/**
 * Consumer of drained sample batches, invoked once per flush.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SampleBatchHandler {
  /**
   * Applies a batch in order. Implementations must not throw for individual malformed samples.
   *
   * @param samples batch drained from the buffer; may be empty
   * @return counts of applied and dropped samples
   */
  ApplyResult apply(List<Sample> samples);
}
