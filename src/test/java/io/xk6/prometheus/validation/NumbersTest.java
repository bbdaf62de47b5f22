package io.xk6.prometheus.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(5656, Numbers.requireRange("port", 5656, 0, 65535));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("port", -1, 0, 65535));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("port", 65536, 0, 65535));
  }

  @Test
  void parseInRangeTrimsAndParses() {
    assertEquals(9090, Numbers.parseInRange("port", " 9090 ", 0, 65535));
  }

  @Test
  void parseInRangeRejectsNonNumbers() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("port", "90a", 0, 65535));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("port", " ", 0, 65535));
  }
}
