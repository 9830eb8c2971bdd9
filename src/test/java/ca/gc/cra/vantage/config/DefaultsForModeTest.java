package ca.gc.cra.vantage.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void resolveHasNoScheduleKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("resolve");

    assertEquals("-", defaults.get("out"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertFalse(defaults.containsKey("refreshIntervalSeconds"));
  }

  @Test
  void watchAddsScheduleKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" WATCH ");

    assertEquals("60", defaults.get("refreshIntervalSeconds"));
    assertEquals("0", defaults.get("cycles"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
