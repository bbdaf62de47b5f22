package io.xk6.prometheus.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsAndKeepsOptionStringWhole() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"out=port=9090&namespace=k6", "interval=500"});

    assertEquals("port=9090&namespace=k6", map.get("out"));
    assertEquals("500", map.get("interval"));
  }

  @Test
  void rejectsArgumentsWithoutValue() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"out="}));
  }

  @Test
  void rejectsInvalidKeys() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"o ut=x"}));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
