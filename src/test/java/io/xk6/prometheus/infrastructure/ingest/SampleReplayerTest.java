package io.xk6.prometheus.infrastructure.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.xk6.prometheus.domain.sample.Sample;
import java.io.BufferedReader;
import java.io.StringReader;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

class SampleReplayerTest {

  private static String point(String metric, double value) {
    return "{\"type\":\"Point\",\"metric\":\"" + metric + "\",\"data\":{\"value\":" + value
        + ",\"tags\":{\"scenario\":\"default\"}}}\n";
  }

  @Test
  void replaysAllPointsToSink() throws Exception {
    StringBuilder input = new StringBuilder();
    input.append("{\"type\":\"Metric\",\"data\":{\"name\":\"vus\",\"type\":\"gauge\"}}\n");
    for (int i = 0; i < 1_000; i++) {
      input.append(point("vus", i));
    }
    input.append("garbage\n\n");
    List<Sample> received = new CopyOnWriteArrayList<>();
    List<Integer> batchSizes = new CopyOnWriteArrayList<>();

    try (SampleReplayer replayer = new SampleReplayer(new BufferedReader(new StringReader(input.toString())),
        batch -> {
          batchSizes.add(batch.size());
          received.addAll(batch);
        })) {
      replayer.start();
      assertTrue(replayer.awaitCompletion(5_000));
      assertEquals(1_000, replayer.forwarded());
    }

    assertEquals(1_000, received.size());
    assertEquals(999.0, received.get(999).value());
    assertTrue(batchSizes.stream().allMatch(size -> size <= SampleReplayer.MAX_BATCH));
  }

  @Test
  void emptySourceCompletesWithoutForwarding() throws Exception {
    List<Sample> received = new CopyOnWriteArrayList<>();
    SampleReplayer replayer = new SampleReplayer(new BufferedReader(new StringReader("")), received::addAll);

    replayer.run();

    assertTrue(replayer.awaitCompletion(0));
    assertEquals(0, replayer.forwarded());
    assertTrue(received.isEmpty());
  }

  @Test
  void startTwiceIsRejected() throws Exception {
    try (SampleReplayer replayer = new SampleReplayer(
        new BufferedReader(new StringReader(point("vus", 1))), batch -> { })) {
      replayer.start();
      assertThrows(IllegalStateException.class, replayer::start);
      assertTrue(replayer.awaitCompletion(5_000));
    }
  }
}
