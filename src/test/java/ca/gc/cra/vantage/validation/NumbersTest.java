package ca.gc.cra.vantage.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1L, Numbers.requireRange("interval", 1, 1, 10));
    assertEquals(10L, Numbers.requireRange("interval", 10, 1, 10));
  }

  @Test
  void requireRangeRejectsOutside() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("interval", 11, 1, 10));
    assertEquals("interval must be between 1 and 10 (was 11)", ex.getMessage());
  }

  @Test
  void parseLongUsesDefaultForBlank() {
    assertEquals(7L, Numbers.parseLong("cycles", " ", 7));
    assertEquals(7L, Numbers.parseLong("cycles", null, 7));
    assertEquals(42L, Numbers.parseLong("cycles", " 42 ", 7));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("cycles", "4x", 7));
  }
}
