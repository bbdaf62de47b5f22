package io.xk6.prometheus.infrastructure.buffer;

import io.xk6.prometheus.application.port.SampleBuffer;
import io.xk6.prometheus.domain.sample.Sample;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link SampleBuffer} backed by a list swapped out under a short lock.
 * <p>The lock only guards a list append or a reference swap, so producers never wait on catalog work. A
 * drain hands the old list to the caller and installs a fresh one; appends racing with the swap land in
 * exactly one of the two lists.</p>
 *
 * @since 0.1.0
 */
public final class LockingSampleBuffer implements SampleBuffer {
  private static final int INITIAL_CAPACITY = 256;

  private final ReentrantLock lock = new ReentrantLock();
  private ArrayList<Sample> pending = new ArrayList<>(INITIAL_CAPACITY);

  @Override
  public void addSamples(Collection<Sample> samples) {
    if (samples == null || samples.isEmpty()) {
      return;
    }
    lock.lock();
    try {
      pending.addAll(samples);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Appends a single sample.
   *
   * @param sample sample to buffer; {@code null} is ignored
   */
  public void addSample(Sample sample) {
    if (sample == null) {
      return;
    }
    lock.lock();
    try {
      pending.add(sample);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<Sample> drain() {
    ArrayList<Sample> drained;
    lock.lock();
    try {
      if (pending.isEmpty()) {
        return List.of();
      }
      drained = pending;
      pending = new ArrayList<>(Math.max(INITIAL_CAPACITY, drained.size()));
    } finally {
      lock.unlock();
    }
    return drained;
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }
}
