package io.xk6.prometheus.infrastructure.ingest;

import io.xk6.prometheus.domain.sample.Sample;
import io.xk6.prometheus.infrastructure.exec.ExecutorFactories;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams samples from a k6 NDJSON source into a sink on a background daemon thread.
 * <p>Samples are handed over in batches of up to {@value #MAX_BATCH}; a partial batch is flushed whenever the
 * source has no more input ready, so a tailed stream is forwarded promptly.</p>
 *
 * @since 0.1.0
 */
public final class SampleReplayer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SampleReplayer.class);
  static final int MAX_BATCH = 512;

  private final BufferedReader source;
  private final Consumer<List<Sample>> sink;
  private final NdjsonSampleReader reader = new NdjsonSampleReader();
  private final CountDownLatch finished = new CountDownLatch(1);
  private volatile boolean closed;
  private volatile long forwarded;
  private Thread thread;

  /**
   * Creates a replayer.
   *
   * @param source NDJSON source; closed when replay ends
   * @param sink receives each batch, typically the output's {@code addSamples}
   */
  public SampleReplayer(BufferedReader source, Consumer<List<Sample>> sink) {
    this.source = Objects.requireNonNull(source, "source");
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  /**
   * Starts the background reader thread.
   */
  public synchronized void start() {
    if (thread != null) {
      throw new IllegalStateException("Replayer already started");
    }
    thread = ExecutorFactories.newDaemonThread("ndjson-replay", this::run,
        (t, ex) -> log.error("Replay thread terminated unexpectedly", ex));
    thread.start();
  }

  void run() {
    List<Sample> batch = new ArrayList<>(MAX_BATCH);
    try {
      String line;
      while (!closed && (line = source.readLine()) != null) {
        reader.parseLine(line).ifPresent(batch::add);
        if (batch.size() >= MAX_BATCH || (!batch.isEmpty() && !source.ready())) {
          forward(batch);
          batch = new ArrayList<>(MAX_BATCH);
        }
      }
      forward(batch);
      log.info("Replay finished: {} samples forwarded, {} malformed lines skipped",
          forwarded, reader.malformedLines());
    } catch (InterruptedIOException ex) {
      log.debug("Replay interrupted");
      Thread.currentThread().interrupt();
    } catch (IOException ex) {
      if (!closed) {
        log.error("Failed to read k6 JSON input", ex);
      }
    } finally {
      closeSource();
      finished.countDown();
    }
  }

  private void forward(List<Sample> batch) {
    if (batch.isEmpty()) {
      return;
    }
    sink.accept(batch);
    forwarded += batch.size();
  }

  /**
   * Waits for the source to be exhausted.
   *
   * @param timeoutMillis maximum wait
   * @return {@code true} if replay finished within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitCompletion(long timeoutMillis) throws InterruptedException {
    return finished.await(timeoutMillis, TimeUnit.MILLISECONDS);
  }

  /**
   * Samples handed to the sink so far.
   *
   * @return forwarded sample count
   */
  public long forwarded() {
    return forwarded;
  }

  @Override
  public void close() {
    closed = true;
    Thread running;
    synchronized (this) {
      running = thread;
    }
    if (running != null) {
      running.interrupt();
    }
  }

  private void closeSource() {
    try {
      source.close();
    } catch (IOException ex) {
      log.debug("Failed to close k6 JSON input", ex);
    }
  }
}
