package io.xk6.prometheus.infrastructure.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.xk6.prometheus.domain.sample.MetricKind;
import io.xk6.prometheus.domain.sample.Sample;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class NdjsonSampleReaderTest {
  private static final String METRIC_LINE =
      "{\"type\":\"Metric\",\"data\":{\"name\":\"http_reqs\",\"type\":\"counter\",\"contains\":\"default\"},"
          + "\"metric\":\"http_reqs\"}";
  private static final String POINT_LINE =
      "{\"type\":\"Point\",\"data\":{\"time\":\"2024-05-01T10:00:00.123+02:00\",\"value\":1,"
          + "\"tags\":{\"status\":\"200\",\"method\":\"GET\",\"group\":null,\"expected\":true}},"
          + "\"metric\":\"http_reqs\"}";

  @Test
  void pointAfterMetricCarriesDeclaredKind() {
    NdjsonSampleReader reader = new NdjsonSampleReader();

    assertTrue(reader.parseLine(METRIC_LINE).isEmpty());
    assertEquals(Optional.of(MetricKind.COUNTER), reader.declaredKind("http_reqs"));

    Sample sample = reader.parseLine(POINT_LINE).orElseThrow();
    assertEquals("http_reqs", sample.name());
    assertEquals(1.0, sample.value());
    assertEquals(Optional.of(MetricKind.COUNTER), sample.kindHint());
    assertEquals(Instant.parse("2024-05-01T08:00:00.123Z"), sample.timestamp());
    assertEquals(Map.of("status", "200", "method", "GET", "expected", "true"), sample.tags());
  }

  @Test
  void pointWithoutDeclarationHasNoKindHint() {
    NdjsonSampleReader reader = new NdjsonSampleReader();

    Sample sample = reader.parseLine(POINT_LINE).orElseThrow();

    assertTrue(sample.kindHint().isEmpty());
  }

  @Test
  void blankLinesYieldNothing() {
    NdjsonSampleReader reader = new NdjsonSampleReader();

    assertTrue(reader.parseLine("").isEmpty());
    assertTrue(reader.parseLine("   ").isEmpty());
    assertTrue(reader.parseLine(null).isEmpty());
    assertEquals(0, reader.malformedLines());
  }

  @Test
  void malformedLinesAreCountedAndSkipped() {
    NdjsonSampleReader reader = new NdjsonSampleReader();

    assertTrue(reader.parseLine("{not json").isEmpty());
    assertTrue(reader.parseLine("[1,2]").isEmpty());
    assertTrue(reader.parseLine("{\"type\":\"Point\",\"metric\":\"x\",\"data\":{\"value\":\"high\"}}").isEmpty());
    assertTrue(reader.parseLine("{\"type\":\"Metric\",\"data\":{\"name\":\"x\",\"type\":\"histogram\"}}").isEmpty());

    assertEquals(4, reader.malformedLines());
    assertTrue(reader.parseLine(POINT_LINE).isPresent());
  }

  @Test
  void unparseableTimeFallsBackToNow() {
    NdjsonSampleReader reader = new NdjsonSampleReader();
    Instant before = Instant.now();

    Sample sample = reader.parseLine(
        "{\"type\":\"Point\",\"metric\":\"vus\",\"data\":{\"time\":\"yesterday\",\"value\":3}}").orElseThrow();

    assertNotNull(sample.timestamp());
    assertTrue(!sample.timestamp().isBefore(before));
    assertTrue(sample.tags().isEmpty());
  }

  @Test
  void otherRecordTypesAreIgnored() {
    NdjsonSampleReader reader = new NdjsonSampleReader();

    assertTrue(reader.parseLine("{\"type\":\"Summary\",\"data\":{}}").isEmpty());
    assertEquals(0, reader.malformedLines());
  }
}
