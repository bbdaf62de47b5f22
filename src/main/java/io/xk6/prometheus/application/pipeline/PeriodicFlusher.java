package io.xk6.prometheus.application.pipeline;

import io.xk6.prometheus.application.port.ApplyResult;
import io.xk6.prometheus.application.port.ClockPort;
import io.xk6.prometheus.application.port.MetricsPort;
import io.xk6.prometheus.application.port.SampleBatchHandler;
import io.xk6.prometheus.application.port.SampleBuffer;
import io.xk6.prometheus.domain.sample.Sample;
import io.xk6.prometheus.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drains the sample buffer into the batch handler on a fixed interval.
 * <p>The flusher is a two-state machine, {@link State#IDLE} and {@link State#FLUSHING}. A timer thread emits
 * ticks; a tick that finds the flusher still {@code FLUSHING} is skipped rather than queued, so samples simply
 * stay buffered until the next tick. Flush work runs on a dedicated single worker thread (named
 * <code>flush-worker-</code>), which keeps flushes totally ordered.</p>
 * <p>{@link #stop()} cancels the timer, waits for an in-flight flush, and then performs one final
 * drain-and-apply on the calling thread. It is idempotent and safe before {@link #start()}. An interrupt
 * received while stopping is restored once the final flush is done.</p>
 *
 * @since 0.1.0
 */
public final class PeriodicFlusher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PeriodicFlusher.class);
  private static final Duration STOP_WAIT_SLICE = Duration.ofSeconds(5);

  /** Flusher states. */
  public enum State {
    IDLE,
    FLUSHING
  }

  private final SampleBuffer buffer;
  private final SampleBatchHandler handler;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Duration interval;
  private final String threadPrefix;
  private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();
  private final LongAdder skippedTicks = new LongAdder();
  private final LongAdder completedFlushes = new LongAdder();
  private final Object stopLock = new Object();

  private volatile ScheduledExecutorService ticker;
  private volatile ExecutorService worker;

  /**
   * Creates a flusher.
   *
   * @param buffer buffer drained on every flush
   * @param handler handler receiving each drained batch
   * @param interval tick interval; also the overrun threshold
   * @param metrics self-telemetry sink
   * @param clock monotonic time source for duration measurement
   */
  public PeriodicFlusher(
      SampleBuffer buffer,
      SampleBatchHandler handler,
      Duration interval,
      MetricsPort metrics,
      ClockPort clock) {
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.interval = Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.threadPrefix = "flush-" + Integer.toHexString(System.identityHashCode(this));
  }

  /**
   * Starts the timer. The first tick fires one interval after this call.
   *
   * @throws IllegalStateException if already started or stopped
   */
  public void start() {
    synchronized (stopLock) {
      if (stopped.get()) {
        throw new IllegalStateException("Flusher already stopped");
      }
      if (started.get()) {
        throw new IllegalStateException("Flusher already started");
      }
      UncaughtExceptionHandler crashHandler =
          (thread, ex) -> log.error("Flush thread {} terminated unexpectedly", thread.getName(), ex);
      worker = ExecutorFactories.newSingleWorker(threadPrefix + "-worker", crashHandler);
      ticker = ExecutorFactories.newTicker(threadPrefix + "-ticker", crashHandler);
      started.set(true);
      long periodNanos = interval.toNanos();
      ticker.scheduleAtFixedRate(this::tick, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
    }
    log.debug("Periodic flusher started with interval {} ms", interval.toMillis());
  }

  /**
   * Handles one timer tick: hands a flush to the worker unless one is still running.
   *
   * @return {@code true} if a flush was scheduled, {@code false} if the tick was skipped
   */
  boolean tick() {
    // a tick either hands its flush to the worker before stop() begins or sees stopped; never both
    synchronized (stopLock) {
      if (stopped.get() || !started.get()) {
        return false;
      }
      if (!state.compareAndSet(State.IDLE, State.FLUSHING)) {
        skippedTicks.increment();
        metrics.increment("exporter.flush.skipped");
        log.debug("Skipping flush tick; previous flush still running ({} samples pending)", buffer.size());
        return false;
      }
      try {
        worker.execute(this::flushAndRelease);
        return true;
      } catch (RejectedExecutionException ex) {
        state.set(State.IDLE);
        log.debug("Flush tick rejected during shutdown");
        return false;
      }
    }
  }

  private void flushAndRelease() {
    try {
      flushOnce();
    } finally {
      state.set(State.IDLE);
    }
  }

  /**
   * Drains the buffer and applies the batch. Caller must own the {@code FLUSHING} state.
   */
  private void flushOnce() {
    MDC.put("pipeline", "flush");
    long startNanos = clock.nanoTime();
    int sampleCount = 0;
    try {
      List<Sample> batch = buffer.drain();
      sampleCount = batch.size();
      ApplyResult result = handler.apply(batch);
      long elapsedNanos = clock.nanoTime() - startNanos;
      completedFlushes.increment();
      metrics.observe("exporter.flush.duration_nanos", elapsedNanos);
      metrics.observe("exporter.flush.samples", sampleCount);
      metrics.observe("exporter.samples.applied", result.applied());
      metrics.observe("exporter.samples.dropped", result.dropped());
      if (result.dropped() > 0) {
        log.debug("Flush applied {} samples, dropped {}", result.applied(), result.dropped());
      }
      if (elapsedNanos > interval.toNanos()) {
        metrics.increment("exporter.flush.overrun");
        log.warn("Flush took longer than the {} ms interval: flush_duration={} ms sample_count={}",
            interval.toMillis(), TimeUnit.NANOSECONDS.toMillis(elapsedNanos), sampleCount);
      }
    } catch (RuntimeException ex) {
      log.error("Flush of {} samples failed", sampleCount, ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  /**
   * Stops ticking, waits for an in-flight flush, then flushes whatever is still buffered.
   * <p>Idempotent; concurrent callers block until the first stop completes. Returns immediately when the
   * flusher was never started. No catalog mutation happens after this method returns.</p>
   */
  public void stop() {
    synchronized (stopLock) {
      if (!stopped.compareAndSet(false, true) || !started.get()) {
        return;
      }
      ticker.shutdownNow();
      worker.shutdown();
      boolean interrupted = awaitWorker();
      if (state.compareAndSet(State.IDLE, State.FLUSHING)) {
        try {
          flushOnce();
        } finally {
          state.set(State.IDLE);
        }
      } else {
        log.warn("Flusher still {} after worker shutdown; final flush skipped", state.get());
      }
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
      log.debug("Periodic flusher stopped after {} flushes ({} ticks skipped)",
          completedFlushes.sum(), skippedTicks.sum());
    }
  }

  /**
   * Waits for the worker to finish its in-flight flush. An interrupt is recorded and the wait continues.
   *
   * @return whether the calling thread was interrupted while waiting
   */
  private boolean awaitWorker() {
    boolean interrupted = false;
    while (true) {
      try {
        if (worker.awaitTermination(STOP_WAIT_SLICE.toMillis(), TimeUnit.MILLISECONDS)) {
          return interrupted;
        }
        log.info("Waiting for in-flight flush to complete");
      } catch (InterruptedException ex) {
        if (!interrupted) {
          log.warn("Interrupted while stopping; still waiting for the in-flight flush");
        }
        interrupted = true;
      }
    }
  }

  @Override
  public void close() {
    stop();
  }

  /**
   * Current state.
   *
   * @return {@code IDLE} or {@code FLUSHING}
   */
  public State state() {
    return state.get();
  }

  /**
   * Ticks skipped because a flush was still running.
   *
   * @return skipped tick count
   */
  public long skippedTicks() {
    return skippedTicks.sum();
  }

  /**
   * Flushes completed, including the final flush performed by {@link #stop()}.
   *
   * @return completed flush count
   */
  public long completedFlushes() {
    return completedFlushes.sum();
  }

  public Duration interval() {
    return interval;
  }
}
