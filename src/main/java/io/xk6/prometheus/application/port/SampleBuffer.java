package io.xk6.prometheus.application.port;

import io.xk6.prometheus.domain.sample.Sample;
import java.util.Collection;
import java.util.List;

/**
 * <strong>What:</strong> Port accumulating samples between flushes.
 * <p><strong>Why:</strong> Decouples producers (engine threads, replay readers) from the catalog so appends never
 * wait on metric creation or scrape serialization.</p>
 * <p><strong>Role:</strong> Multi-writer append, single-reader drain; drained by the periodic flusher.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent appends during a drain without losing
 * or duplicating samples.</p>
 *
 * @since 0.1.0
 */
public interface SampleBuffer {
  /**
   * Appends samples in iteration order.
   *
   * @param samples samples to buffer; {@code null} or empty is a no-op
   */
  void addSamples(Collection<Sample> samples);

  /**
   * Atomically takes everything buffered since the previous call.
   *
   * @return buffered samples in append order; empty when nothing was buffered
   */
  List<Sample> drain();

  /**
   * Number of samples currently buffered.
   *
   * @return pending sample count
   */
  int size();
}
