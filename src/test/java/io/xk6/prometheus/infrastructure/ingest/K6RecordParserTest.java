package io.xk6.prometheus.infrastructure.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.xk6.prometheus.infrastructure.ingest.K6RecordParser.K6Record;
import java.util.Map;
import org.junit.jupiter.api.Test;

class K6RecordParserTest {
  private final K6RecordParser parser = new K6RecordParser();

  @Test
  void brokenJsonReportsTheParserMessage() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"type\": "));

    assertTrue(ex.getMessage().startsWith("invalid JSON: "), ex.getMessage());
    assertInstanceOf(JsonProcessingException.class, ex.getCause());
  }

  @Test
  void pointRecordExposesValueAndTags() {
    K6Record record = parser.parse("{\"type\":\"Point\",\"metric\":\"vus\","
        + "\"data\":{\"time\":\"2024-01-01T00:00:00Z\",\"value\":7,\"tags\":{\"scenario\":\"default\",\"n\":1,\"x\":null}}}");

    assertEquals("Point", record.type());
    assertEquals("vus", record.metric());
    assertEquals(7.0, record.value());
    assertEquals(Map.of("scenario", "default", "n", "1"), record.tags());
    assertTrue(record.hasData());
  }

  @Test
  void trailingContentIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"type\":\"Point\"} {}"));
  }
}
