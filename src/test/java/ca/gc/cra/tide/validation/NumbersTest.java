package ca.gc.cra.tide.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10L, Numbers.requireRange("batchSize", 10L, 1L, 10_000L));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("batchSize", 0L, 1L, 10_000L));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("batchSize", 10_001L, 1L, 10_000L));
  }

  @Test
  void fractionalRangeRejectsNaN() {
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("batchInterval", Double.NaN, 0d, 60d));
    assertEquals(0.5d, Numbers.requireRange("readingInterval", 0.5d, 0d, 60d));
  }
}
