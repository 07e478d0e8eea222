package ca.gc.cra.vigil.guard;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsInclusiveBounds() {
    assertEquals(0, Numbers.requireRange("n", 0, 0, 10));
    assertEquals(10, Numbers.requireRange("n", 10, 0, 10));
  }

  @Test
  void requireRangeRejectsOutOfRange() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("n", 11, 0, 10));
    assertEquals("n must be between 0 and 10 (was 11)", ex.getMessage());
  }

  @Test
  void parseNonNegativeIntRejectsNegativesAndGarbage() {
    assertEquals(12, Numbers.parseNonNegativeInt("maxLength", " 12 "));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseNonNegativeInt("maxLength", "-1"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseNonNegativeInt("maxLength", "1.5"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseNonNegativeInt("maxLength", "99999999999"));
  }

  @Test
  void parseFiniteRejectsNaNAndInfinity() {
    assertEquals(-2.5, Numbers.parseFinite("min", "-2.5"));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseFinite("min", "Infinity"));
    assertEquals("min must be finite (was Infinity)", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseFinite("min", "ten"));
  }
}
