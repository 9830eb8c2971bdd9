package ca.gc.cra.vantage.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "bad\u0007"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndCharset() {
    assertEquals("team=net", Strings.requirePrintableAscii("attrs", "team=net", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "x".repeat(17), 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 16));
  }

  @Test
  void parseBooleanIsStrict() {
    assertTrue(Strings.parseBoolean("verbose", "TRUE", false));
    assertFalse(Strings.parseBoolean("verbose", "false", true));
    assertTrue(Strings.parseBoolean("verbose", "", true));
    assertThrows(IllegalArgumentException.class, () -> Strings.parseBoolean("verbose", "1", false));
  }
}
