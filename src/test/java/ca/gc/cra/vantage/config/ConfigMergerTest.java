package ca.gc.cra.vantage.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "watch",
        Optional.of(Map.of("topology", "/yaml/topology.json", "agents", "/yaml/agents.json", "cycles", "5")),
        Map.of("topology", "/cli/topology.json"),
        DefaultsForMode.asFlatMap("watch"),
        warnings::add);

    assertEquals("/cli/topology.json", effective.get("topology"));
    assertEquals("/yaml/agents.json", effective.get("agents"));
    assertEquals("5", effective.get("cycles"));
    assertEquals("60", effective.get("refreshIntervalSeconds"));
    assertEquals(List.of("CLI overrides YAML for key: topology"), warnings);
  }

  @Test
  void missingInputsAreRequired() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "resolve", Optional.empty(), Map.of("topology", "t.json"), DefaultsForMode.asFlatMap("resolve"), null));

    assertEquals("agents is required", ex.getMessage());
  }

  @Test
  void watchValidatesScheduleKeys() {
    Map<String, String> base = Map.of("topology", "t.json", "agents", "a.json");

    assertThrows(IllegalArgumentException.class, () -> merge("watch", base, "refreshIntervalSeconds", "0"));
    assertThrows(IllegalArgumentException.class, () -> merge("watch", base, "refreshIntervalSeconds", "86401"));
    assertThrows(IllegalArgumentException.class, () -> merge("watch", base, "cycles", "-1"));
    assertThrows(IllegalArgumentException.class, () -> merge("watch", base, "cycles", "many"));
    assertEquals("86400", merge("watch", base, "refreshIntervalSeconds", "86400").get("refreshIntervalSeconds"));
  }

  @Test
  void exporterMustBeKnown() {
    Map<String, String> base = Map.of("topology", "t.json", "agents", "a.json");

    assertThrows(IllegalArgumentException.class, () -> merge("resolve", base, "metricsExporter", "prometheus"));
    assertTrue(merge("resolve", base, "metricsExporter", "OTLP").containsKey("metricsExporter"));
  }

  private static Map<String, String> merge(String mode, Map<String, String> base, String key, String value) {
    Map<String, String> cli = new HashMap<>(base);
    cli.put(key, value);
    return ConfigMerger.buildEffectiveConfig(mode, Optional.empty(), cli, DefaultsForMode.asFlatMap(mode), null);
  }
}
