package ca.gc.cra.vantage.config;

import ca.gc.cra.vantage.validation.Numbers;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML, and CLI settings with precedence CLI &gt; YAML &gt; defaults and checks the cross-key
 * rules of the merged result.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration for {@code mode}.
   *
   * @param mode CLI mode
   * @param yaml YAML settings, empty when no config file was given or found
   * @param cli CLI overrides; may be {@code null}
   * @param defaults embedded defaults; may be {@code null}
   * @param warn receives one message per CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged settings
   * @throws IllegalArgumentException when the merged settings are invalid
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        if (yamlValues.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, value);
      });
    }
    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    requirePresent(effective, "topology");
    requirePresent(effective, "agents");

    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }

    if (DefaultsForMode.WATCH.equalsIgnoreCase(mode.trim())) {
      long interval = Numbers.parseLong(
          "refreshIntervalSeconds", effective.get("refreshIntervalSeconds"), ResolverConfig.DEFAULT_REFRESH_SECONDS);
      Numbers.requireRange(
          "refreshIntervalSeconds", interval, 1, ResolverConfig.MAX_REFRESH_SECONDS);
      long cycles = Numbers.parseLong("cycles", effective.get("cycles"), 0);
      Numbers.requireRange("cycles", cycles, 0, Long.MAX_VALUE);
    }
  }

  private static void requirePresent(Map<String, String> effective, String key) {
    if (trim(effective.get(key)).isEmpty()) {
      throw new IllegalArgumentException(key + " is required");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
