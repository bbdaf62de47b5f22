package io.xk6.prometheus.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("http_reqs", Logs.truncate("http_reqs", 64));
  }

  @Test
  void longValuesAreCutAtByteLimit() {
    String truncated = Logs.truncate("abcdefghij", 4);

    assertTrue(truncated.startsWith("abcd..."));
    assertTrue(truncated.contains("4 of 10 bytes"));
  }

  @Test
  void multiByteCharactersAreNotSplit() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é..."));
  }

  @Test
  void nullIsRenderedAsPlaceholder() {
    assertEquals("<null>", Logs.truncate(null, 4));
  }

  @Test
  void nonPositiveLimitIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void safeEscapesLineBreaksBeforeTruncating() {
    assertEquals("reqs\\nFAKE ENTRY", Logs.safe("reqs\nFAKE ENTRY", 64));
    assertEquals("a\\u0007b", Logs.safe("a\u0007b", 64));
    assertTrue(Logs.safe("x\r\n".repeat(20), 8).startsWith("x\\r\\nx\\r..."));
  }

  @Test
  void safeLeavesPrintableTextAlone() {
    String value = "http_req_duration{status=200}";

    assertSame(value, Logs.safe(value, 64));
  }
}
