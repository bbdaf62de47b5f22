package io.xk6.prometheus.infrastructure.buffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.xk6.prometheus.domain.sample.MetricKind;
import io.xk6.prometheus.domain.sample.Sample;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class LockingSampleBufferTest {

  private static Sample sample(int i) {
    return Sample.of("reqs", MetricKind.COUNTER, i, Map.of());
  }

  @Test
  void drainReturnsSamplesInAppendOrderAndEmptiesBuffer() {
    LockingSampleBuffer buffer = new LockingSampleBuffer();
    buffer.addSamples(List.of(sample(1), sample(2)));
    buffer.addSample(sample(3));

    List<Sample> drained = buffer.drain();

    assertEquals(List.of(1.0, 2.0, 3.0), drained.stream().map(Sample::value).toList());
    assertEquals(0, buffer.size());
    assertTrue(buffer.drain().isEmpty());
  }

  @Test
  void nullAndEmptyBatchesAreIgnored() {
    LockingSampleBuffer buffer = new LockingSampleBuffer();
    buffer.addSamples(null);
    buffer.addSamples(List.of());
    buffer.addSample(null);

    assertEquals(0, buffer.size());
  }

  @Test
  void concurrentProducersAndDrainerLoseNothing() throws Exception {
    LockingSampleBuffer buffer = new LockingSampleBuffer();
    int producers = 4;
    int perProducer = 5_000;
    ExecutorService executor = Executors.newFixedThreadPool(producers);
    CountDownLatch start = new CountDownLatch(1);
    AtomicBoolean producing = new AtomicBoolean(true);
    AtomicInteger drained = new AtomicInteger();
    try {
      for (int p = 0; p < producers; p++) {
        executor.submit(() -> {
          start.await();
          for (int i = 0; i < perProducer; i++) {
            buffer.addSample(sample(i));
          }
          return null;
        });
      }
      Thread drainer = new Thread(() -> {
        while (producing.get()) {
          drained.addAndGet(buffer.drain().size());
        }
      });
      drainer.start();
      start.countDown();
      executor.shutdown();
      assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
      producing.set(false);
      drainer.join(5_000);
      drained.addAndGet(buffer.drain().size());
    } finally {
      executor.shutdownNow();
    }

    assertEquals(producers * perProducer, drained.get());
  }
}
