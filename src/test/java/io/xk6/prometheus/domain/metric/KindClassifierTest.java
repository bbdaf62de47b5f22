package io.xk6.prometheus.domain.metric;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.xk6.prometheus.domain.sample.MetricKind;
import io.xk6.prometheus.domain.sample.Sample;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class KindClassifierTest {

  @Test
  void hintWinsOverName() {
    Sample sample = Sample.of("http_req_duration", MetricKind.GAUGE, 3, Map.of());

    assertEquals(MetricKind.GAUGE, KindClassifier.classify(sample));
  }

  @Test
  void builtinMetricsUseDocumentedTypes() {
    assertEquals(Optional.of(MetricKind.COUNTER), KindClassifier.infer("http_reqs"));
    assertEquals(Optional.of(MetricKind.GAUGE), KindClassifier.infer("vus_max"));
    assertEquals(Optional.of(MetricKind.RATE), KindClassifier.infer("checks"));
    assertEquals(Optional.of(MetricKind.TREND), KindClassifier.infer("iteration_duration"));
    assertEquals(Optional.of(MetricKind.RATE), KindClassifier.infer("http_req_failed"));
  }

  @Test
  void customMetricsFallBackToNamingConventions() {
    assertEquals(Optional.of(MetricKind.COUNTER), KindClassifier.infer("orders_total"));
    assertEquals(Optional.of(MetricKind.TREND), KindClassifier.infer("login_latency"));
    assertEquals(Optional.of(MetricKind.RATE), KindClassifier.infer("cache_hit_rate"));
    assertEquals(Optional.of(MetricKind.GAUGE), KindClassifier.infer("queue_max"));
  }

  @Test
  void unknownNameWithoutHintIsRejected() {
    Sample sample = new Sample("mystery", 1, java.time.Instant.now(), Map.of(), null);

    assertTrue(KindClassifier.infer("mystery").isEmpty());
    SampleClassificationException ex =
        assertThrows(SampleClassificationException.class, () -> KindClassifier.classify(sample));
    assertEquals("kind", ex.field());
  }
}
